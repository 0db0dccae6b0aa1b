package com.payment.plan.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.payment.plan.domain.EventKind;
import com.payment.plan.domain.NormalizedPaymentEvent;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EventNormalizerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final EventNormalizer normalizer =
            new EventNormalizer(new FieldPathResolver(), new EventKindClassifier(), new MoneyParser());

    private JsonNode json(String body) throws Exception {
        return mapper.readTree(body);
    }

    @Test
    void normalizesSubscriptionCharge() throws Exception {
        NormalizedPaymentEvent event = normalizer.normalize(json("""
                {
                  "notificationId": "evt-1",
                  "eventType": "net.authorize.payment.authcapture.created",
                  "eventDate": "2024-05-01T10:00:00Z",
                  "payload": {
                    "id": "60012345678",
                    "authAmount": 993.33,
                    "subscription": { "id": "SUB-42" },
                    "order": { "invoiceNumber": "Q-1001" },
                    "customer": { "email": "pat@example.com" }
                  }
                }
                """));

        assertThat(event.getEventId()).isEqualTo("evt-1");
        assertThat(event.getKind()).isEqualTo(EventKind.INSTALLMENT_PAID);
        assertThat(event.getSubscriptionId()).isEqualTo("SUB-42");
        assertThat(event.getTransactionId()).isEqualTo("60012345678");
        assertThat(event.getAmount()).isEqualByComparingTo("993.33");
        assertThat(event.getInvoiceNumber()).isEqualTo("Q-1001");
        assertThat(event.getCustomerEmail()).isEqualTo("pat@example.com");
        assertThat(event.getEventDate()).isEqualTo("2024-05-01T10:00:00Z");
    }

    @Test
    void subscriptionIdFoundInAlternateLocations() throws Exception {
        NormalizedPaymentEvent flat = normalizer.normalize(json("""
                {"eventType": "net.authorize.payment.authcapture.created",
                 "payload": {"transId": "T-1", "subscriptionId": "SUB-7", "settleAmount": "$1,993.33"}}
                """));
        NormalizedPaymentEvent nested = normalizer.normalize(json("""
                {"eventType": "net.authorize.payment.authcapture.created",
                 "payload": {"transactionId": "T-2", "data": {"subscription": {"id": "SUB-8"}}}}
                """));

        assertThat(flat.getSubscriptionId()).isEqualTo("SUB-7");
        assertThat(flat.getTransactionId()).isEqualTo("T-1");
        assertThat(flat.getAmount()).isEqualByComparingTo("1993.33");
        assertThat(nested.getSubscriptionId()).isEqualTo("SUB-8");
        assertThat(nested.getTransactionId()).isEqualTo("T-2");
        assertThat(nested.getAmount()).isEqualByComparingTo("0.00");
    }

    @Test
    void managementEventsReadSubscriptionIdFromPayloadId() throws Exception {
        NormalizedPaymentEvent event = normalizer.normalize(json("""
                {"id": "evt-9", "eventType": "net.authorize.customer.subscription.suspended",
                 "payload": {"id": "SUB-42", "name": "Plan Q-1001"}}
                """));

        assertThat(event.getKind()).isEqualTo(EventKind.PLAN_SUSPENDED);
        assertThat(event.getSubscriptionId()).isEqualTo("SUB-42");
        assertThat(event.getTransactionId()).isNull();
    }

    @Test
    void blankValuesAreSkippedInFavourOfLaterPaths() throws Exception {
        NormalizedPaymentEvent event = normalizer.normalize(json("""
                {"eventType": "net.authorize.payment.authcapture.created",
                 "payload": {"id": "  ", "transId": "T-3", "subscription": {}, "subscriptionId": "SUB-3"}}
                """));

        assertThat(event.getTransactionId()).isEqualTo("T-3");
        assertThat(event.getSubscriptionId()).isEqualTo("SUB-3");
    }

    @Test
    void unrecognisedShapesNeverThrow() throws Exception {
        assertThat(normalizer.normalize(null).getKind()).isEqualTo(EventKind.UNSUPPORTED);
        assertThat(normalizer.normalize(MissingNode.getInstance()).getKind()).isEqualTo(EventKind.UNSUPPORTED);
        assertThat(normalizer.normalize(json("[1, 2, 3]")).getKind()).isEqualTo(EventKind.UNSUPPORTED);
        assertThat(normalizer.normalize(json("\"text\"")).getKind()).isEqualTo(EventKind.UNSUPPORTED);

        NormalizedPaymentEvent noPayload = normalizer.normalize(json("{\"eventType\": \"invoicing.customer.invoice.paid\"}"));
        assertThat(noPayload.getKind()).isEqualTo(EventKind.INSTALLMENT_PAID);
        assertThat(noPayload.getSubscriptionId()).isNull();
        assertThat(noPayload.getAmount()).isEqualByComparingTo("0.00");
        assertThat(noPayload.getCustomerEmail()).isEmpty();
    }
}
