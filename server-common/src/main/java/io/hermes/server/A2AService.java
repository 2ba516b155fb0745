package io.hermes.server;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.hermes.server.bus.MessageBus;
import io.hermes.server.config.A2AConfig;
import io.hermes.server.conversations.ConversationManager;
import io.hermes.server.coordination.TaskCoordinator;
import io.hermes.server.dispatch.MethodDispatcher;
import io.hermes.server.events.ChannelBridge;
import io.hermes.server.events.DomainEventBridge;
import io.hermes.server.events.EventStreamer;
import io.hermes.server.events.SubscriptionManager;
import io.hermes.server.methods.AgentMethods;
import io.hermes.server.methods.AuthMethods;
import io.hermes.server.methods.ChannelMethods;
import io.hermes.server.methods.ConversationMethods;
import io.hermes.server.methods.DiscoveryMethods;
import io.hermes.server.methods.TaskMethods;
import io.hermes.server.methods.WorkflowMethods;
import io.hermes.server.registry.AgentRegistry;
import io.hermes.server.registry.DiscoveryService;
import io.hermes.server.registry.LivenessMonitor;
import io.hermes.server.security.AccessControl;
import io.hermes.server.security.MessageSigner;
import io.hermes.server.security.SecurityInterceptor;
import io.hermes.server.security.TokenManager;
import io.hermes.server.tasks.InMemoryTaskStore;
import io.hermes.server.tasks.TaskManager;
import io.hermes.spec.A2AError;
import io.hermes.spec.AgentCard;
import io.hermes.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the engine together and connects it to the message bus.
 * <p>
 * The constructor builds every component and registers the full method surface on a dispatcher
 * whose interceptor chain is fixed at that point: the {@link SecurityInterceptor} is installed
 * when security is enabled. {@link #initialize()} creates the A2A channels, subscribes to the
 * registration manager's topic, bridges domain events to the {@link EventStreamer} and starts the
 * liveness sweeper. {@link #shutdown()} cancels every running task and stops the background work.
 */
@ApplicationScoped
public class A2AService {

    private static final Logger LOGGER = LoggerFactory.getLogger(A2AService.class);

    public static final String REGISTRATION_CHANNEL = "a2a.registration";
    public static final String TASKS_CHANNEL = "a2a.tasks";
    public static final String DISCOVERY_CHANNEL = "a2a.discovery";
    public static final String REGISTRATION_EVENTS_TOPIC = "registration.events";

    static final List<String> A2A_COMPONENT_CAPABILITIES = List.of("a2a", "agent");

    private final A2AConfig config;
    private final MessageBus messageBus;
    private final @Nullable ExecutorService ownedExecutor;

    private final AgentRegistry agentRegistry;
    private final LivenessMonitor livenessMonitor;
    private final DiscoveryService discoveryService;
    private final AccessControl accessControl;
    private final TokenManager tokenManager;
    private final MessageSigner messageSigner;
    private final TaskManager taskManager;
    private final TaskCoordinator taskCoordinator;
    private final SubscriptionManager subscriptionManager;
    private final ChannelBridge channelBridge;
    private final EventStreamer eventStreamer;
    private final ConversationManager conversationManager;
    private final MethodDispatcher dispatcher;

    private @Nullable AutoCloseable registrationSubscription;
    private boolean initialized;
    private boolean stopped;

    @Inject
    public A2AService(A2AConfig config, MessageBus messageBus) {
        this(config, messageBus, Clock.systemUTC(), newWorkerPool(), true);
    }

    /**
     * @param executor runs method handlers and subscriber deliveries; not shut down by {@link #shutdown()}
     */
    public A2AService(A2AConfig config, MessageBus messageBus, Clock clock, Executor executor) {
        this(config, messageBus, clock, executor, false);
    }

    private A2AService(A2AConfig config, MessageBus messageBus, Clock clock, Executor executor, boolean owned) {
        this.config = config;
        this.messageBus = messageBus;
        this.ownedExecutor = owned ? (ExecutorService) executor : null;

        this.agentRegistry = new AgentRegistry(clock, config.degradedAfter(), config.offlineAfter());
        this.livenessMonitor = new LivenessMonitor(agentRegistry, config.sweepInterval());
        this.discoveryService = new DiscoveryService(agentRegistry);
        this.accessControl = new AccessControl(config.rolePermissions());
        this.tokenManager = new TokenManager(config.secret(), config.tokenTtl(), accessControl, clock);
        this.messageSigner = new MessageSigner(config.secret());
        this.taskManager = new TaskManager(new InMemoryTaskStore(), clock);
        this.taskCoordinator = new TaskCoordinator(taskManager, config.workflowMaxAttempts(), clock);
        this.subscriptionManager = new SubscriptionManager(messageBus, config.multiSegmentWildcards(), executor, clock);
        this.channelBridge = new ChannelBridge(messageBus, subscriptionManager, clock);
        this.eventStreamer = new EventStreamer(channelBridge, messageSigner, config.signingEnabled(), config.source(),
                clock);
        this.conversationManager = new ConversationManager(channelBridge, clock);

        MethodDispatcher.Builder builder = MethodDispatcher.builder().executor(executor);
        if (config.securityEnabled()) {
            builder.interceptor(new SecurityInterceptor(tokenManager, accessControl, config.exemptMethods()));
        } else {
            LOGGER.info("A2A security is disabled, no security interceptor installed");
        }
        this.dispatcher = builder.build();
        new AgentMethods(agentRegistry, messageBus).registerWith(dispatcher);
        new DiscoveryMethods(discoveryService).registerWith(dispatcher);
        new TaskMethods(taskManager).registerWith(dispatcher);
        new AuthMethods(tokenManager, agentRegistry).registerWith(dispatcher);
        new ChannelMethods(channelBridge).registerWith(dispatcher);
        new ConversationMethods(conversationManager).registerWith(dispatcher);
        new WorkflowMethods(taskCoordinator).registerWith(dispatcher);
    }

    private static ExecutorService newWorkerPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "hermes-a2a-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        messageBus.createChannel(REGISTRATION_CHANNEL, "Channel for agent registration events");
        messageBus.createChannel(TASKS_CHANNEL, "Channel for task management events");
        messageBus.createChannel(DISCOVERY_CHANNEL, "Channel for agent discovery events");
        registrationSubscription = messageBus.subscribe(REGISTRATION_EVENTS_TOPIC, this::onRegistrationEvent);

        DomainEventBridge events = new DomainEventBridge(eventStreamer);
        taskManager.addListener(events.taskListener());
        agentRegistry.addListener(events.agentListener());
        taskCoordinator.addListener(events.workflowListener());

        livenessMonitor.start();
        initialized = true;
        LOGGER.info("A2A service initialized with {} methods", dispatcher.getMethods().size());
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (!initialized || stopped) {
            return;
        }
        stopped = true;
        taskManager.cancelAllRunning("Service shutting down");
        livenessMonitor.stop();
        taskCoordinator.shutdown();
        if (registrationSubscription != null) {
            try {
                registrationSubscription.close();
            } catch (Exception e) {
                LOGGER.warn("Failed to close the registration subscription", e);
            }
            registrationSubscription = null;
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
        LOGGER.info("A2A service shut down");
    }

    /**
     * Translates registration manager events into registry operations.
     */
    void onRegistrationEvent(Map<String, Object> event) {
        Object type = event.get("type");
        Map<String, Object> component = asMap(event.get("component"));
        Object componentId = component.get("component_id");
        if ("component_registered".equals(type)) {
            if (asList(component.get("capabilities")).stream().noneMatch(A2A_COMPONENT_CAPABILITIES::contains)) {
                LOGGER.debug("Component {} does not speak A2A, not registered", componentId);
                return;
            }
            AgentCard card = componentCard(component);
            agentRegistry.register(card);
            AgentCard stored = Utils.defaultIfNull(agentRegistry.get(card.id()), card);
            messageBus.publish(REGISTRATION_CHANNEL,
                    Map.of("type", "agent_registered", "agent", Utils.toMap(stored)));
            LOGGER.info("Registered component {} as A2A agent", card.id());
        } else if ("component_deregistered".equals(type) && componentId instanceof String id) {
            if (agentRegistry.unregister(id) != null) {
                subscriptionManager.removeAgent(id);
                messageBus.publish(REGISTRATION_CHANNEL, Map.of("type", "agent_deregistered", "agent_id", id));
                LOGGER.info("Deregistered A2A agent {}", id);
            }
        } else if ("component_heartbeat".equals(type) && componentId instanceof String id) {
            try {
                agentRegistry.updateHeartbeat(id);
            } catch (A2AError e) {
                LOGGER.debug("Heartbeat of unknown component {} ignored", id);
            }
        }
    }

    private static AgentCard componentCard(Map<String, Object> component) {
        Map<String, Object> metadata = asMap(component.get("metadata"));
        Object id = component.get("component_id");
        if (!(id instanceof String)) {
            throw new IllegalArgumentException("Registration event without component_id");
        }
        return AgentCard.builder()
                .id((String) id)
                .name(stringOr(component.get("name"), "Unknown"))
                .description(stringOr(metadata.get("description"), ""))
                .version(stringOr(component.get("version"), "0.1.0"))
                .capabilities(asList(component.get("capabilities")))
                .supportedMethods(asList(component.get("supported_methods")))
                .endpoint(component.get("endpoint") instanceof String endpoint ? endpoint : null)
                .metadata(metadata)
                .build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(@Nullable Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    private static List<String> asList(@Nullable Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream().filter(String.class::isInstance).map(String.class::cast).toList();
    }

    private static String stringOr(@Nullable Object value, String defaultValue) {
        return value instanceof String string ? string : defaultValue;
    }

    public A2AConfig getConfig() {
        return config;
    }

    public MethodDispatcher getDispatcher() {
        return dispatcher;
    }

    public AgentRegistry getAgentRegistry() {
        return agentRegistry;
    }

    public DiscoveryService getDiscoveryService() {
        return discoveryService;
    }

    public TokenManager getTokenManager() {
        return tokenManager;
    }

    public AccessControl getAccessControl() {
        return accessControl;
    }

    public MessageSigner getMessageSigner() {
        return messageSigner;
    }

    public TaskManager getTaskManager() {
        return taskManager;
    }

    public TaskCoordinator getTaskCoordinator() {
        return taskCoordinator;
    }

    public SubscriptionManager getSubscriptionManager() {
        return subscriptionManager;
    }

    public ChannelBridge getChannelBridge() {
        return channelBridge;
    }

    public EventStreamer getEventStreamer() {
        return eventStreamer;
    }

    public ConversationManager getConversationManager() {
        return conversationManager;
    }
}
