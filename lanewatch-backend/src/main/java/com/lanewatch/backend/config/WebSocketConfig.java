package com.lanewatch.backend.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over WebSocket for live dashboards. One {@code TrafficSnapshot} is pushed to
 * /topic/traffic after every analysed frame.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    public static final String TRAFFIC_TOPIC = "/topic/traffic";

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/topic");
        config.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/traffic-stream")
                .setAllowedOriginPatterns("*");
        // Browsers behind proxies that strip the upgrade header
        registry.addEndpoint("/traffic-stream/sockjs")
                .setAllowedOriginPatterns("*")
                .withSockJS();
    }
}
