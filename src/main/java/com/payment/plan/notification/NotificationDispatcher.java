package com.payment.plan.notification;

import com.payment.plan.domain.Plan;
import com.payment.plan.domain.TransitionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Fans a committed transition out to every enabled {@link NotificationSink}. Each sink runs on the
 * notification executor inside its own try/catch, so one slow or failing sink neither delays the
 * webhook response nor prevents the others from firing.
 */
@Slf4j
@Component
public class NotificationDispatcher {

    private final List<NotificationSink> sinks;
    private final Executor executor;

    public NotificationDispatcher(List<NotificationSink> sinks,
                                  @Qualifier("notificationExecutor") Executor executor) {
        this.sinks = sinks;
        this.executor = executor;
        log.info("Notification sinks registered: {}", sinks.stream().map(NotificationSink::getName).collect(Collectors.toList()));
    }

    public void dispatch(TransitionResult result) {
        if (result == null || !result.isApplied() || result.getPlan() == null) {
            return;
        }
        Plan plan = result.getPlan();
        switch (result.getKind()) {
            case INSTALLMENT_PAID:
                int paymentNumber = result.getPaymentNumber() != null
                        ? result.getPaymentNumber() : plan.getCompletedPayments();
                fanOut("installment-paid", plan, sink -> sink.notifyInstallmentPaid(plan, paymentNumber));
                break;
            case PLAN_SUSPENDED:
                fanOut("plan-suspended", plan, sink -> sink.notifyPlanSuspended(plan));
                break;
            case PLAN_CANCELLED:
                fanOut("plan-cancelled", plan, sink -> sink.notifyPlanCancelled(plan));
                break;
            default:
                break;
        }
    }

    private void fanOut(String notification, Plan plan, Consumer<NotificationSink> call) {
        for (NotificationSink sink : sinks) {
            if (!sink.isEnabled()) {
                continue;
            }
            try {
                executor.execute(() -> invoke(sink, notification, plan, call));
            } catch (RejectedExecutionException e) {
                log.warn("Notification executor rejected {} for sink={}, planId={}",
                        notification, sink.getName(), plan.getId());
            }
        }
    }

    private void invoke(NotificationSink sink, String notification, Plan plan, Consumer<NotificationSink> call) {
        try {
            call.accept(sink);
            log.debug("Sent {} notification via sink={}, planId={}", notification, sink.getName(), plan.getId());
        } catch (Exception e) {
            log.warn("Notification {} failed for sink={}, planId={}: {}",
                    notification, sink.getName(), plan.getId(), e.getMessage());
        }
    }
}
