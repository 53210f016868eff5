package com.fibagent.agent.ecmp;

import com.fibagent.core.model.NextHop;

import java.util.List;

/**
 * Export view of one next-hop group: its id, route usage and members.
 */
public record NextHopGroupInfo(long id, long population, List<NextHop> nextHops) {
}
