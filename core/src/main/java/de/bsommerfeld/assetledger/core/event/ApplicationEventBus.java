package de.bsommerfeld.assetledger.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process notifications about ledger state: who logged in or out, and
 * whether the last backup succeeded.
 *
 * <p>
 * Account and backup services post {@link SessionEvents} and
 * {@link BackupEvents} here. Delivery is synchronous on the posting thread,
 * so auto-backup events arrive on the backup worker. A subscriber that throws
 * is logged and skipped; it never fails the login or backup that posted the
 * event.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::logSubscriberFailure);
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void logSubscriberFailure(Throwable exception, SubscriberExceptionContext context) {
        LOG.error("Listener {}.{} failed on {}", context.getSubscriber().getClass().getName(),
                context.getSubscriberMethod().getName(), context.getEvent(), exception);
    }
}
