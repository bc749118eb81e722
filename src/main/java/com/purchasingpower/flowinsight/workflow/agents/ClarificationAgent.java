package com.purchasingpower.flowinsight.workflow.agents;

import com.purchasingpower.flowinsight.client.ModelGateway;
import com.purchasingpower.flowinsight.config.AnalysisConfig;
import com.purchasingpower.flowinsight.exception.ModelTransientException;
import com.purchasingpower.flowinsight.model.llm.ModelRequest;
import com.purchasingpower.flowinsight.model.prompt.RenderedPrompt;
import com.purchasingpower.flowinsight.service.PromptLibraryService;
import com.purchasingpower.flowinsight.workflow.AnalysisStage;
import com.purchasingpower.flowinsight.workflow.state.AgentState;
import com.purchasingpower.flowinsight.workflow.state.AnalysisPhase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prepares the questions shown to the user when the data is incomplete.
 *
 * <p>Sources, first non-empty wins: questions written by the model, the
 * scorer's improvement suggestions, then "Please provide: &lt;gap&gt;" for the
 * most critical gaps. A transient model failure falls through to the next
 * source; a configuration error is not caught.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClarificationAgent implements AnalysisStage {

    public static final String TASK_CLARIFICATION = "clarification";

    private static final Pattern NUMBERED = Pattern.compile("^\\d+[.):]\\s*(.+)$");
    private static final Pattern BULLETED = Pattern.compile("^[-*]\\s*(.+)$");

    private final ModelGateway modelGateway;
    private final PromptLibraryService promptLibrary;
    private final AnalysisConfig config;

    @Override
    public AnalysisPhase phase() {
        return AnalysisPhase.REQUEST_CLARIFICATION;
    }

    @Override
    public AgentState execute(AgentState state) {
        log.info("📋 Requesting clarification - awaiting user input");
        int max = config.getMaxClarificationQuestions();

        Optional<List<String>> generated = config.isLlmClarificationEnabled()
                ? generateQuestions(state, max)
                : Optional.empty();

        List<String> questions;
        if (generated.isPresent()) {
            questions = generated.get();
        } else if (!state.getClarificationQuestions().isEmpty()) {
            questions = state.getClarificationQuestions();
        } else {
            questions = state.getDataGaps().stream()
                    .limit(max)
                    .map(gap -> "Please provide: " + gap)
                    .toList();
        }

        String reasoning = "Requesting clarification: " + questions.size() + " questions";
        if (generated.isPresent()) {
            reasoning += " (LLM generated)";
        }

        return state.toBuilder()
                .needsClarification(true)
                .clarificationQuestions(List.copyOf(questions))
                .build()
                .withTrace(reasoning, config.getMaxTraceEntries());
    }

    private Optional<List<String>> generateQuestions(AgentState state, int max) {
        try {
            Map<String, Object> vars = new HashMap<>();
            vars.put("confidencePct", String.format("%.0f", state.getConfidenceScore() * 100));
            vars.put("phase", "initial_analysis");
            vars.put("dataGaps", state.getDataGaps());
            vars.put("maxQuestions", max);
            RenderedPrompt prompt = promptLibrary.render("clarification", vars);

            String reply = modelGateway.generateText(ModelRequest.builder()
                    .task(TASK_CLARIFICATION)
                    .analysisMode(state.getAnalysisMode())
                    .provider(state.getLlmProvider())
                    .systemPrompt(prompt.systemPrompt())
                    .userPrompt(prompt.userPrompt())
                    .build());

            List<String> questions = parseQuestions(reply, max);
            log.info("🤖 LLM generated {} clarification questions", questions.size());
            return Optional.of(questions);
        } catch (ModelTransientException e) {
            log.warn("LLM clarification question generation failed, using fallback: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Numbered or bulleted lines become questions. A reply without any list
     * lines is used as a single question.
     */
    static List<String> parseQuestions(String reply, int max) {
        List<String> questions = new ArrayList<>();
        for (String raw : reply.split("\\R")) {
            String line = raw.strip();
            Matcher numbered = NUMBERED.matcher(line);
            Matcher bulleted = BULLETED.matcher(line);
            if (numbered.matches()) {
                questions.add(numbered.group(1).strip());
            } else if (bulleted.matches()) {
                questions.add(bulleted.group(1).strip());
            }
        }
        if (questions.isEmpty()) {
            log.warn("Could not parse LLM response into questions, using as-is");
            return List.of(reply.strip());
        }
        return questions.subList(0, Math.min(max, questions.size()));
    }
}
