package com.oracle.deepsearch.service;

import com.oracle.deepsearch.model.QueryConfig;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class PromptTemplateService {

    public String createQueryPrompt(String topic, List<String> priorFindings, int batchSize) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an expert research planner driving an iterative web search.\n\n");
        prompt.append("Research topic: ").append(topic).append("\n\n");

        if (priorFindings == null || priorFindings.isEmpty()) {
            prompt.append("This is the first research round; nothing has been found yet.\n\n");
        } else {
            prompt.append("Findings from previous rounds:\n");
            for (int i = 0; i < priorFindings.size(); i++) {
                prompt.append("\nRound ").append(i + 1).append(":\n").append(priorFindings.get(i)).append("\n");
            }
            prompt.append("\nBuild on these findings: fill gaps, verify uncertain facts and go deeper "
                    + "where the answers were thin. Do not repeat questions that are already answered.\n\n");
        }

        prompt.append("Propose ").append(batchSize).append(" or fewer web search queries.\n");
        prompt.append("For each query give between 1 and ").append(QueryConfig.MAX_GOALS)
                .append(" specific questions (goals) that the pages found by the query must answer.\n");
        prompt.append("Queries should be short, the way a person types them into a search engine.\n\n");
        prompt.append("Respond in the following JSON format:\n");
        prompt.append("{\n");
        prompt.append("  \"queries\": [\n");
        prompt.append("    {\"query\": \"search query\", \"goals\": [\"question 1\", \"question 2\"]}\n");
        prompt.append("  ]\n");
        prompt.append("}\n");

        return prompt.toString();
    }

    public String createReportPrompt(String topic, List<String> allFindings) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an expert at synthesizing research.\n\n");
        prompt.append("Research topic: ").append(topic).append("\n\n");
        prompt.append("Findings collected over ").append(allFindings.size()).append(" research rounds:\n");

        for (int i = 0; i < allFindings.size(); i++) {
            prompt.append("\nRound ").append(i + 1).append(":\n").append(allFindings.get(i)).append("\n");
        }

        prompt.append("\nWrite a comprehensive, well structured report on the topic using only these findings.\n");
        prompt.append("Cite concrete numbers and dates where the findings give them.\n\n");
        prompt.append("Respond in the following JSON format:\n");
        prompt.append("{\n");
        prompt.append("  \"mainReport\": \"the full report\",\n");
        prompt.append("  \"keyLearnings\": [\"learning 1\", \"learning 2\", ...],\n");
        prompt.append("  \"areasCovered\": [\"area 1\", ...],\n");
        prompt.append("  \"areasToExplore\": [\"open question 1\", ...],\n");
        prompt.append("  \"additionalNotes\": \"caveats or contradictions, may be empty\"\n");
        prompt.append("}\n");

        return prompt.toString();
    }
}
