package io.amprelay.routing;

public interface DeliveryNotifier {
    void notify(DeliveryNotice notice) throws Exception;
}
