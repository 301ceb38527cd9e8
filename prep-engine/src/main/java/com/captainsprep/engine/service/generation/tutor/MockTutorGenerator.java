package com.captainsprep.engine.service.generation.tutor;

import com.captainsprep.engine.service.generation.ItemGenerator;

public class MockTutorGenerator implements ItemGenerator<String> {

    @Override
    public String generate(String topic, String context) {
        String subject = subjectOf(topic);
        return "**HOOK**: Alright, let's talk about " + subject + ". On the fireground this matters because you "
                + "calculate flow rates, pressure drops and equipment capacity while under pressure.\n\n"
                + "**ANALOGY**: Think of hose sections. A standard pre-connect is 200 feet, so a quarter of the line "
                + "is 50 feet, one section.\n\n"
                + "**PRACTICE**: If your engine carries 500 gallons and you are flowing 125 GPM, how many minutes "
                + "until you are dry?\n\n"
                + "**VERIFY**: Walk me through how you would solve that. What is the first step?\n\n"
                + "[Mock response, configure the language model for personalised tutoring]";
    }

    private static String subjectOf(String topic) {
        if (topic == null || topic.isBlank()) {
            return "this concept";
        }
        String firstLine = topic.strip().split("\\r?\\n", 2)[0];
        int colon = firstLine.lastIndexOf(':');
        return colon >= 0 ? firstLine.substring(colon + 1).trim() : firstLine.trim();
    }
}
