package com.agenteval.service;

import com.agenteval.model.AgentResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Orders agent results by score descending. Equal scores keep the evaluation's agent order.
 */
public final class ResultRanking {

    private static final List<String> MEDALS = List.of("🥇", "🥈", "🥉");

    private ResultRanking() {
    }

    public static List<RankedResult> rank(List<String> agentOrder, List<AgentResult> results) {
        Map<String, AgentResult> byAgent = results.stream()
                .filter(result -> result.getScore() != null)
                .collect(Collectors.toMap(AgentResult::getAgentName, Function.identity(), (first, second) -> first));

        List<AgentResult> ordered = new ArrayList<>();
        for (String agent : agentOrder) {
            AgentResult result = byAgent.remove(agent);
            if (result != null) {
                ordered.add(result);
            }
        }
        // Rows for agents no longer listed go last, by name.
        byAgent.values().stream()
                .sorted(Comparator.comparing(AgentResult::getAgentName))
                .forEach(ordered::add);

        ordered.sort(Comparator.comparingInt(AgentResult::getScore).reversed());

        List<RankedResult> ranked = new ArrayList<>(ordered.size());
        for (int index = 0; index < ordered.size(); index++) {
            AgentResult result = ordered.get(index);
            ranked.add(new RankedResult(
                    index + 1,
                    result.getAgentName(),
                    result.getScore(),
                    medalFor(index + 1),
                    result.getFeedback(),
                    result.getBreakdown()
            ));
        }
        return ranked;
    }

    public static String medalFor(int rank) {
        return rank >= 1 && rank <= MEDALS.size() ? MEDALS.get(rank - 1) : "";
    }
}
