package com.intteq.reliable.message.broker.binding;

import com.intteq.reliable.message.broker.routing.RoutingKeyMatcher;
import lombok.Value;

/**
 * A binding together with its handler and compiled routing-key matcher.
 */
@Value
public class ListenerRegistration {

    Binding binding;
    MessageHandler handler;
    RoutingKeyMatcher matcher;

    public static ListenerRegistration of(Binding binding, MessageHandler handler) {
        return new ListenerRegistration(binding, handler, RoutingKeyMatcher.compile(binding.getRoutingKey()));
    }

    public String getRoutingKeyPattern() {
        return binding.getRoutingKey();
    }

    public String getQueue() {
        return binding.getQueue();
    }

    public boolean matches(String routingKey) {
        return matcher.matches(routingKey);
    }
}
