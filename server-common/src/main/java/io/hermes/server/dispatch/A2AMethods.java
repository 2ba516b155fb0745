package io.hermes.server.dispatch;

import java.util.List;

/**
 * Names of every RPC method of the engine.
 */
public final class A2AMethods {

    public static final String AGENT_REGISTER = "agent.register";
    public static final String AGENT_UNREGISTER = "agent.unregister";
    public static final String AGENT_HEARTBEAT = "agent.heartbeat";
    public static final String AGENT_UPDATE_STATUS = "agent.update_status";
    public static final String AGENT_GET = "agent.get";
    public static final String AGENT_LIST = "agent.list";
    public static final String AGENT_FORWARD = "agent.forward";

    public static final String DISCOVERY_QUERY = "discovery.query";
    public static final String DISCOVERY_FIND_FOR_METHOD = "discovery.find_for_method";
    public static final String DISCOVERY_FIND_FOR_CAPABILITY = "discovery.find_for_capability";
    public static final String DISCOVERY_CAPABILITY_MAP = "discovery.capability_map";
    public static final String DISCOVERY_METHOD_MAP = "discovery.method_map";

    public static final String TASK_CREATE = "task.create";
    public static final String TASK_ASSIGN = "task.assign";
    public static final String TASK_START = "task.start";
    public static final String TASK_UPDATE_STATE = "task.update_state";
    public static final String TASK_UPDATE_PROGRESS = "task.update_progress";
    public static final String TASK_COMPLETE = "task.complete";
    public static final String TASK_FAIL = "task.fail";
    public static final String TASK_CANCEL = "task.cancel";
    public static final String TASK_GET = "task.get";
    public static final String TASK_LIST = "task.list";

    public static final String AUTH_LOGIN = "auth.login";
    public static final String AUTH_REFRESH = "auth.refresh";

    public static final String CHANNEL_SUBSCRIBE = "channel.subscribe";
    public static final String CHANNEL_UNSUBSCRIBE = "channel.unsubscribe";
    public static final String CHANNEL_PUBLISH = "channel.publish";
    public static final String CHANNEL_LIST = "channel.list";
    public static final String CHANNEL_INFO = "channel.info";
    public static final String CHANNEL_SUBSCRIBE_PATTERN = "channel.subscribe_pattern";

    public static final String CONVERSATION_CREATE = "conversation.create";
    public static final String CONVERSATION_JOIN = "conversation.join";
    public static final String CONVERSATION_LEAVE = "conversation.leave";
    public static final String CONVERSATION_SEND = "conversation.send";
    public static final String CONVERSATION_LIST = "conversation.list";
    public static final String CONVERSATION_INFO = "conversation.info";
    public static final String CONVERSATION_REQUEST_TURN = "conversation.request_turn";
    public static final String CONVERSATION_GRANT_TURN = "conversation.grant_turn";
    public static final String CONVERSATION_END = "conversation.end";

    public static final String WORKFLOW_CREATE = "workflow.create";
    public static final String WORKFLOW_CREATE_SEQUENTIAL = "workflow.create_sequential";
    public static final String WORKFLOW_CREATE_PARALLEL = "workflow.create_parallel";
    public static final String WORKFLOW_CREATE_PIPELINE = "workflow.create_pipeline";
    public static final String WORKFLOW_CREATE_FANOUT = "workflow.create_fanout";
    public static final String WORKFLOW_START = "workflow.start";
    public static final String WORKFLOW_CANCEL = "workflow.cancel";
    public static final String WORKFLOW_INFO = "workflow.info";
    public static final String WORKFLOW_LIST = "workflow.list";
    public static final String WORKFLOW_ADD_TASK = "workflow.add_task";
    public static final String WORKFLOW_ADD_DEPENDENCY = "workflow.add_dependency";

    /**
     * Methods callable without a token unless configured otherwise.
     */
    public static final List<String> DEFAULT_EXEMPT_METHODS = List.of(
            AGENT_REGISTER,
            DISCOVERY_CAPABILITY_MAP,
            DISCOVERY_FIND_FOR_CAPABILITY,
            DISCOVERY_QUERY,
            AUTH_LOGIN,
            AUTH_REFRESH);

    private A2AMethods() {
    }
}
