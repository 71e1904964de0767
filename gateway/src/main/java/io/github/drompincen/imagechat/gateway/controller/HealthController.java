package io.github.drompincen.imagechat.gateway.controller;

import io.github.drompincen.imagechat.gateway.websocket.ImageChatWebSocketHandler;
import io.github.drompincen.imagechat.runtime.generation.GenerationGateway;
import io.github.drompincen.imagechat.runtime.session.SessionRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final GenerationGateway gateway;
    private final SessionRegistry registry;
    private final ImageChatWebSocketHandler connections;

    public HealthController(GenerationGateway gateway, SessionRegistry registry,
                            ImageChatWebSocketHandler connections) {
        this.gateway = gateway;
        this.registry = registry;
        this.connections = connections;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("generation_configured", gateway.isAvailable());
        body.put("model", gateway.modelName());
        body.put("loaded_sessions", registry.states().size());
        body.put("open_connections", connections.connectionCount());
        return body;
    }
}
