package com.myorg.streamhub.eventing.broker;

@FunctionalInterface
public interface StreamBrokerFactory {
    /**
     * Opens a broker with its own connection.
     *
     * @param owner readable name of the owning component, used as connection client name
     */
    StreamBroker open(String owner);
}
