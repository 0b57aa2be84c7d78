package com.p14n.pgtopics.listener;

@FunctionalInterface
public interface ListenerCallback {

    /**
     * Called on the listener thread. Exceptions are logged by the listener.
     */
    void onNotification(Notification notification) throws Exception;
}
