package com.agentgraph.engine;

import java.util.Collection;

/**
 * Where the supervisor sends the run: one of the agents known at run start, the
 * responder, or the end of the run.
 */
public record RouteTarget(Kind kind, String agentName) {

    public static final String RESPOND = "RESPOND";
    public static final String TERMINATE = "TERMINATE";
    public static final String END_ALIAS = "__end__";

    public enum Kind {
        AGENT,
        RESPOND,
        TERMINATE
    }

    public static RouteTarget parse(String next, Collection<String> agentNames) {
        String value = next == null ? "" : next.trim();
        if (RESPOND.equalsIgnoreCase(value)) {
            return new RouteTarget(Kind.RESPOND, null);
        }
        if (TERMINATE.equalsIgnoreCase(value) || END_ALIAS.equals(value)) {
            return new RouteTarget(Kind.TERMINATE, null);
        }
        for (String agent : agentNames) {
            if (agent.equals(value)) {
                return new RouteTarget(Kind.AGENT, agent);
            }
        }
        throw new RoutingException("Supervisor chose unknown destination '" + value + "'");
    }
}
