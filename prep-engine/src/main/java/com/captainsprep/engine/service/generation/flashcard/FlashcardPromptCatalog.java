package com.captainsprep.engine.service.generation.flashcard;

import com.captainsprep.engine.model.CardType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Prompt templates per card type and subject, and the card types each subject supports.
 */
@Component
public class FlashcardPromptCatalog {

    public static final List<String> SUBJECTS = List.of("human-relations", "mechanical-aptitude", "reading-ability", "math");

    private static final String DEFAULT_SUBJECT = "default";

    private static final Map<String, List<CardType>> SUBJECT_CARD_TYPES = Map.of(
            "human-relations", List.of(CardType.TERM_DEFINITION, CardType.SCENARIO_ACTION),
            "mechanical-aptitude", List.of(CardType.TERM_DEFINITION, CardType.FILL_BLANK),
            "reading-ability", List.of(CardType.TERM_DEFINITION),
            "math", List.of(CardType.TERM_DEFINITION, CardType.FILL_BLANK)
    );

    private final Map<CardType, Map<String, String>> templates = new EnumMap<>(CardType.class);

    public FlashcardPromptCatalog() {
        templates.put(CardType.TERM_DEFINITION, Map.of(
                "human-relations", termDefinition("Human Relations",
                        "teamwork, communication, leadership, conflict resolution, or station culture",
                        "A specific fire service term or leadership concept", "Human Relations"),
                "mechanical-aptitude", termDefinition("Mechanical Aptitude",
                        "fire tools, hydraulics, pumps, mechanical advantage, or leverage",
                        "A specific tool, equipment, or mechanical concept", "Mechanical Aptitude"),
                "reading-ability", termDefinition("Reading Comprehension",
                        "SOP terminology, fire codes, NFPA standards, or incident command",
                        "A specific fire service term or acronym", "SOPs & Standards"),
                "math", termDefinition("Fire Math",
                        "flow rates, friction loss, percentages, or pump calculations",
                        "A specific formula name or calculation concept", "Fire Math"),
                DEFAULT_SUBJECT, termDefinition("Fire Service",
                        "fire service terminology",
                        "A specific fire service term", "Fire Service")
        ));
        templates.put(CardType.SCENARIO_ACTION, Map.of(
                "human-relations", """
                        Generate ONE flashcard for firefighter exam prep on Human Relations.
                        Create a SCENARIO -> ACTION card testing decision-making.

                        IMPORTANT: always prioritize private, peer-to-peer resolution at the lowest level.

                        Return in this exact format:
                        SCENARIO: [A realistic firehouse scenario requiring judgment, 1-2 sentences]
                        ACTION: [The best response, 1-2 sentences]
                        SOURCE: Human Relations""",
                DEFAULT_SUBJECT, """
                        Generate ONE flashcard for firefighter exam prep.
                        Create a SCENARIO -> ACTION card.

                        Return in this exact format:
                        SCENARIO: [A realistic fire service scenario, 1-2 sentences]
                        ACTION: [The correct response, 1-2 sentences]
                        SOURCE: Fire Service"""
        ));
        templates.put(CardType.FILL_BLANK, Map.of(
                "math", """
                        Generate ONE flashcard for firefighter exam prep on Fire Math.
                        Create a FILL-IN-THE-BLANK card testing specific numeric knowledge.

                        Return in this exact format:
                        PROMPT: [A question with a blank, e.g. "Standard handline flow rate is ___ GPM"]
                        ANSWER: [The correct value with a short explanation]
                        SOURCE: Fire Math""",
                "mechanical-aptitude", """
                        Generate ONE flashcard for firefighter exam prep on Mechanical Aptitude.
                        Create a FILL-IN-THE-BLANK card testing technical knowledge.

                        Return in this exact format:
                        PROMPT: [A question with a blank about tools or equipment]
                        ANSWER: [The correct answer with a short explanation]
                        SOURCE: Mechanical Aptitude""",
                DEFAULT_SUBJECT, """
                        Generate ONE flashcard for firefighter exam prep.
                        Create a FILL-IN-THE-BLANK card.

                        Return in this exact format:
                        PROMPT: [A question with a blank]
                        ANSWER: [The correct value with a short explanation]
                        SOURCE: Fire Service"""
        ));
    }

    public String template(CardType cardType, String subject) {
        Map<String, String> byType = templates.get(cardType);
        String key = subject == null ? DEFAULT_SUBJECT : subject.trim().toLowerCase(Locale.ROOT);
        return byType.getOrDefault(key, byType.get(DEFAULT_SUBJECT));
    }

    public List<CardType> cardTypesFor(String subject) {
        String key = subject == null ? "" : subject.trim().toLowerCase(Locale.ROOT);
        return SUBJECT_CARD_TYPES.getOrDefault(key, List.of(CardType.TERM_DEFINITION));
    }

    private static String termDefinition(String area, String about, String termHint, String source) {
        return "Generate ONE flashcard for firefighter exam prep on " + area + ".\n"
                + "Create a term/definition card about: " + about + ".\n\n"
                + "Return in this exact format:\n"
                + "TERM: [" + termHint + "]\n"
                + "DEFINITION: [A clear, concise definition in 1-2 sentences]\n"
                + "SOURCE: " + source;
    }
}
