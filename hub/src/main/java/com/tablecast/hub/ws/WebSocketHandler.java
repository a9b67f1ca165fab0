package com.tablecast.hub.ws;

import com.tablecast.core.model.MesaRef;
import com.tablecast.core.msg.InboundMessage;
import com.tablecast.core.msg.MalformedMessageException;
import com.tablecast.core.msg.MessageTypes;
import com.tablecast.core.msg.OutboundMessages;
import com.tablecast.core.topic.TopicKey;
import com.tablecast.core.util.BytesUtils;
import com.tablecast.hub.config.HubConfig;
import com.tablecast.hub.connection.ConnectionFactory;
import com.tablecast.hub.connection.HubConnection;
import com.tablecast.hub.dispatch.FanoutDispatcher;
import com.tablecast.hub.membership.IMembershipManager;
import com.tablecast.hub.metrics.MetricsService;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.util.function.Consumer;

/**
 * WebSocket handler for client connections.
 * <p>
 * Protocol (client → server):
 * <ul>
 *   <li>join: {trackingId}</li>
 *   <li>join-branch: {branch}</li>
 *   <li>join-mesa: {slug, mesaId}</li>
 *   <li>location: {trackingId, lat, lng}</li>
 *   <li>ping: {}</li>
 * </ul>
 * </p>
 * <p>
 * Protocol (server → client): status, update, order-updated, reload-orders,
 * venta-actualizada, whatsapp-new-message.
 * </p>
 * <p>
 * Inbound frames of one connection are handled one at a time, in arrival order.
 * Joins update the topic index before the next frame is read; the tracking snapshot
 * is sent in the background so a slow order store never holds back later frames.
 * A bad frame is dropped; the connection stays open.
 * </p>
 */
public class WebSocketHandler {
	private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

	private final HubConfig config;
	private final ConnectionFactory connectionFactory;
	private final IMembershipManager membershipManager;
	private final FanoutDispatcher dispatcher;
	private final Consumer<MesaRef> mesaWatcher;
	private final MetricsService metricsService;

	public WebSocketHandler(
			HubConfig config,
			IMembershipManager membershipManager,
			FanoutDispatcher dispatcher,
			Consumer<MesaRef> mesaWatcher,
			MetricsService metricsService
	) {
		this.config = config;
		this.connectionFactory = new ConnectionFactory(config);
		this.membershipManager = membershipManager;
		this.dispatcher = dispatcher;
		this.mesaWatcher = mesaWatcher;
		this.metricsService = metricsService;
	}

	/**
	 * Handles WebSocket connection lifecycle.
	 *
	 * @param inbound      WebSocket inbound
	 * @param outbound     WebSocket outbound
	 * @param connectionId connection identifier
	 * @return Publisher for the connection
	 */
	public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound, String connectionId) {
		MDC.put("connectionId", connectionId);
		HubConnection connection = connectionFactory.create(connectionId);
		membershipManager.onOpen(connection);
		log.debug("WebSocket connection {} opened", connectionId);

		handleConnectionStateUpdates(inbound, outbound, connection);

		return Mono.when(
						outbound.sendString(connection.outbound()
								.doOnNext(frame -> metricsService.recordNetworkOutboundWs(BytesUtils.utf8Length(frame)))),
						handleInboundMessages(inbound, connection)
				)
				.onErrorResume(err -> {
					log.error("WebSocket error for connection {}", connectionId, err);
					return outbound.sendClose();
				})
				.doFinally(signal -> {
					membershipManager.onClose(connection);
					MDC.remove("connectionId");
				});
	}

	private void handleConnectionStateUpdates(WebsocketInbound inbound, WebsocketOutbound outbound,
											  HubConnection connection) {
		inbound.withConnection(conn -> {
			long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;
			long pingIntervalInMillis = config.getPingInterval() * 1000L;

			conn.onWriteIdle(pingIntervalInMillis, () -> conn.outbound().sendObject(
							Mono.just(new PingWebSocketFrame())
					).then().subscribe())
					.onReadIdle(idleTimeoutInMillis, () -> outbound.sendClose().subscribe())
					.onDispose(() -> {
						log.debug("WebSocket connection {} disposed", connection.getId());
						membershipManager.onClose(connection);
					});
		});
	}

	private Mono<Void> handleInboundMessages(WebsocketInbound inbound, HubConnection connection) {
		return inbound.aggregateFrames()
				.receive()
				.asString()
				.onBackpressureBuffer(config.getPerConnBufferSize())
				.concatMap(msg -> handleInboundMessage(connection, msg).onErrorResume(err -> {
							log.warn("Error processing message from {}: {}", connection.getId(), err.getMessage());
							return Mono.empty();
						})
				)
				.doOnError(err -> {
					// AbortedException is expected on close
					if (!(err instanceof AbortedException)) {
						log.error("Fatal error in inbound stream for {}", connection.getId(), err);
					}
				})
				.onErrorResume(err -> Mono.empty())
				.doFinally(signal -> membershipManager.onClose(connection))
				.then();
	}

	/**
	 * Routes one inbound frame.
	 *
	 * @return Mono completing once the frame is routed; never errors for bad input
	 */
	Mono<Void> handleInboundMessage(HubConnection connection, String messageJson) {
		metricsService.recordNetworkInboundWs(BytesUtils.utf8Length(messageJson));
		try {
			log.debug("Processing message from {}: {}", connection.getId(), messageJson);
			return route(connection, InboundMessage.parse(messageJson));
		} catch (MalformedMessageException | IllegalArgumentException e) {
			metricsService.recordMalformed();
			log.warn("Dropping malformed message from {}: {} (message='{}')",
					connection.getId(), e.getMessage(), messageJson);
			return Mono.empty();
		}
	}

	private Mono<Void> route(HubConnection connection, InboundMessage msg) {
		switch (msg.getType()) {
			case MessageTypes.JOIN -> {
				join(connection, TopicKey.tracking(msg.requireTrackingId()));
				return Mono.empty();
			}
			case MessageTypes.JOIN_BRANCH -> {
				join(connection, TopicKey.branch(msg.requireBranch()));
				return Mono.empty();
			}
			case MessageTypes.JOIN_MESA -> {
				MesaRef mesa = new MesaRef(msg.requireSlug(), msg.requireMesaId());
				join(connection, mesa.topic());
				mesaWatcher.accept(mesa);
				return Mono.empty();
			}
			case MessageTypes.LOCATION -> {
				String trackingId = msg.requireTrackingId();
				int delivered = dispatcher.broadcast(TopicKey.tracking(trackingId),
						OutboundMessages.location(msg.requireLat(), msg.requireLng()));
				log.debug("Location for {} relayed to {} connection(s)", trackingId, delivered);
				return Mono.empty();
			}
			case MessageTypes.PING -> {
				// Keepalive ping
				return Mono.empty();
			}
			default -> throw new MalformedMessageException("Unknown message type '" + msg.getType() + "'");
		}
	}

	// onJoin never errors and its lookup is bounded by a timeout
	private void join(HubConnection connection, TopicKey key) {
		membershipManager.onJoin(connection, key).subscribe();
	}
}
