package io.github.drompincen.imagechat.gateway.config;

import io.github.drompincen.imagechat.gateway.websocket.ImageChatWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String ENDPOINT = "/ws/image-chat/*";

    private final ImageChatWebSocketHandler handler;
    private final String[] allowedOrigins;

    public WebSocketConfig(ImageChatWebSocketHandler handler,
                           @Value("${imagechat.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.handler = handler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, ENDPOINT).setAllowedOrigins(allowedOrigins);
    }
}
