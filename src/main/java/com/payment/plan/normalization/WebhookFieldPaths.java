package com.payment.plan.normalization;

import java.util.List;

/**
 * Candidate locations of each semantic field in the gateway's webhook envelope, in priority
 * order. Transaction events (authcapture, capture, invoice) carry the charge id in
 * {@code payload.id}; subscription-management events carry the subscription id there instead,
 * so the two families get separate tables for those fields.
 */
final class WebhookFieldPaths {

    static final List<String> EVENT_ID = List.of("id", "notificationId", "webhookId");

    static final List<String> EVENT_TYPE = List.of("eventType", "event_type", "type");

    static final List<String> EVENT_DATE = List.of(
            "eventDate",
            "payload.eventDate",
            "timestamp",
            "payload.timestamp",
            "payload.submitTimeUTC");

    static final List<String> PAYMENT_SUBSCRIPTION_ID = List.of(
            "payload.subscription.id",
            "payload.subscriptionId",
            "payload.subscription.subscriptionId",
            "payload.data.subscription.id",
            "payload.invoice.subscriptionId");

    static final List<String> MANAGEMENT_SUBSCRIPTION_ID = List.of(
            "payload.subscription.id",
            "payload.subscriptionId",
            "payload.subscription.subscriptionId",
            "payload.data.subscription.id",
            "payload.id");

    static final List<String> PAYMENT_TRANSACTION_ID = List.of(
            "payload.id",
            "payload.transId",
            "payload.transactionId",
            "payload.transaction.transId",
            "payload.transaction.id");

    static final List<String> MANAGEMENT_TRANSACTION_ID = List.of(
            "payload.transId",
            "payload.transactionId",
            "payload.transaction.transId",
            "payload.transaction.id");

    static final List<String> AMOUNT = List.of(
            "payload.authAmount",
            "payload.settleAmount",
            "payload.subscriptionAmount",
            "payload.order.amount",
            "payload.amount",
            "payload.totalAmount",
            "payload.invoice.amount",
            "payload.invoice.totalAmount",
            "payload.data.invoice.amount",
            "payload.subscription.amount");

    static final List<String> CUSTOMER_EMAIL = List.of(
            "payload.customer.email",
            "payload.billTo.email",
            "payload.shipTo.email",
            "payload.invoice.customer.email",
            "payload.invoice.billTo.email",
            "payload.subscription.profile.email",
            "payload.email");

    static final List<String> INVOICE_NUMBER = List.of(
            "payload.order.invoiceNumber",
            "payload.invoiceNumber",
            "payload.invoice.invoiceNumber",
            "payload.invoice.number");

    private WebhookFieldPaths() {
    }
}
