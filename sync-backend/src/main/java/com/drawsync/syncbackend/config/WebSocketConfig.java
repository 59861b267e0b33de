package com.drawsync.syncbackend.config;

import com.drawsync.syncbackend.web.CanvasWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket configuration for the shared canvas.
 *
 * Clients connect with ws://host:port/ws/canvas and then send a handshake message.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final CanvasWebSocketHandler canvasWebSocketHandler;
    private final CorsProperties corsProperties;
    private final CanvasSyncProperties canvasSyncProperties;

    public WebSocketConfig(CanvasWebSocketHandler canvasWebSocketHandler,
                           CorsProperties corsProperties,
                           CanvasSyncProperties canvasSyncProperties) {
        this.canvasWebSocketHandler = canvasWebSocketHandler;
        this.corsProperties = corsProperties;
        this.canvasSyncProperties = canvasSyncProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(canvasWebSocketHandler, "/ws/canvas")
                .setAllowedOriginPatterns(corsProperties.getAllowedOrigins().toArray(String[]::new));
    }

    @Bean
    public ServletServerContainerFactoryBean webSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(canvasSyncProperties.getTransport().getMaxTextMessageSize());
        return container;
    }
}
