package autoaccept.platform;

import autoaccept.model.ChangeKind;

import java.util.Set;

/**
 * What the service asks the platform to deliver: the packages it watches, the
 * change kinds it wants, and the platform-side coalescing window.
 *
 * @param packageNames          monitored application ids
 * @param kinds                 notification kinds to deliver
 * @param notificationTimeoutMs minimum gap the platform keeps between deliveries
 * @param reportViewIds         whether nodes must expose their resource ids
 */
public record EventSubscription(Set<String> packageNames,
                                Set<ChangeKind> kinds,
                                long notificationTimeoutMs,
                                boolean reportViewIds) {

    public EventSubscription {
        packageNames = Set.copyOf(packageNames);
        kinds        = Set.copyOf(kinds);
    }
}
