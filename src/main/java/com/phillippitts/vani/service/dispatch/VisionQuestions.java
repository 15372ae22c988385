package com.phillippitts.vani.service.dispatch;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a vision utterance into the question sent to the vision model, and recognizes
 * follow-ups that refer to the previous frame instead of asking for a new one.
 *
 * <p>Checks run in a fixed order; the first topic that matches decides the question.
 */
final class VisionQuestions {

    static final String TIME = "What time is shown on any clock, watch, or time display visible in this image? "
            + "Read the exact time.";
    static final String PEOPLE_COUNT = "How many people are in this image? Count them carefully.";
    static final String PEOPLE = "Describe the people in this image. Who do you see?";
    static final String OBJECT_COUNT = "Count and list all the objects you can see in this image.";
    static final String COLORS = "What colors do you see in this image? Describe them in detail.";
    static final String LOCATION = "Describe this location. What kind of room or place is this? What can you see?";
    static final String TEXT = "Read all the text visible in this image. What does it say?";
    static final String MAIN_OBJECT = "Describe the main object or item in this image in detail.";
    static final String WEATHER = "If there's a weather display or temperature reading visible, what does it show?";
    static final String PRICES = "If there are any prices or monetary values visible, what are they?";
    static final String SCREEN = "What is displayed on the screen or monitor in this image? Describe what you see.";
    static final String SIGNS = "What signs, labels, or text are visible in this image? Read them.";
    static final String DETAILED = "Describe everything visible in this image in detail - including people, "
            + "objects, text, numbers, colors, and any information displayed.";
    static final String GENERIC = "Describe everything you see in this image in detail, including any text, "
            + "numbers, people, objects, colors, and the setting. Be specific and thorough.";

    private static final List<String> QUESTION_WORDS = List.of(
            "what", "how", "where", "when", "why", "who", "which",
            "क्या", "कैसे", "कहाँ", "कब", "क्यों", "कौन",
            "શું", "કેમ", "ક્યાં", "ક્યારે", "કોણ");

    private static final Set<String> REFERENCES = Set.of(
            "it", "its", "that", "them", "those", "they",
            "इसका", "इसकी", "इसके", "इसे", "उसका", "उसकी", "उसके", "उसे", "वह", "वो",
            "તે", "તેનો", "તેની", "તેનું", "તેને", "એનો", "એની", "એનું", "એને");

    private static final Set<String> CAMERA_WORDS = Set.of("see", "look", "camera", "show", "now", "again",
            "अब", "फिर", "હવે", "ફરી");

    // Hindi and Gujarati verbs inflect, so these match as stems.
    private static final String[] CAMERA_STEMS = {"देख", "दिख", "दीख", "कैमर", "જુઓ", "જોવ", "દેખા", "કેમેર"};

    private VisionQuestions() {
    }

    static String questionFor(String text) {
        if (containsAny(text, "time", "clock", "watch", "समय", "घड़ी", "સમય", "ઘડિયાળ")) {
            return TIME;
        }
        if (containsAny(text, "how many people", "how many person", "कितने लोग", "કેટલા લોકો")) {
            return PEOPLE_COUNT;
        }
        if (containsAny(text, "who is", "who are", "कौन है", "કોણ છે")) {
            return PEOPLE;
        }
        if (containsAny(text, "how many object", "count", "कितने", "કેટલા")) {
            return OBJECT_COUNT;
        }
        if (containsAny(text, "what color", "what colour", "रंग", "રંગ")) {
            return COLORS;
        }
        if (containsAny(text, "where am i", "what room", "what place", "कहाँ", "ક્યાં")) {
            return LOCATION;
        }
        if (containsAny(text, "read", "text", "written", "पढ़", "लिखा", "વાંચ", "લખ્યું")) {
            return TEXT;
        }
        if (containsAny(text, "what is this", "what is on", "what is in")) {
            return MAIN_OBJECT;
        }
        if (containsAny(text, "weather", "temperature", "मौसम", "હવામાન")) {
            return WEATHER;
        }
        if (containsAny(text, "price", "cost", "how much", "कीमत", "કિંમત")) {
            return PRICES;
        }
        if (containsAny(text, "screen", "monitor", "display", "phone", "स्क्रीन", "સ્ક્રીન")) {
            return SCREEN;
        }
        if (containsAny(text, "sign", "label", "साइन", "લેબલ")) {
            return SIGNS;
        }
        if (containsAny(text, "what do you see", "what can you see", "describe", "दिख रहा", "देख रहा", "જુઓ છો")) {
            return DETAILED;
        }
        String trimmed = text.trim();
        if (QUESTION_WORDS.stream().anyMatch(trimmed::startsWith)) {
            return "Answer this question about the image: " + trimmed;
        }
        return GENERIC;
    }

    /**
     * A follow-up refers to the previous frame ("what color is it?") and carries no cue asking
     * for a new look ("look again", "what do you see now").
     */
    static boolean isFollowUp(String text) {
        Set<String> words = words(text);
        boolean referential = words.stream().anyMatch(REFERENCES::contains);
        boolean cameraCue = words.stream().anyMatch(CAMERA_WORDS::contains) || containsAny(text, CAMERA_STEMS);
        return referential && !cameraCue;
    }

    private static Set<String> words(String text) {
        return Arrays.stream(text.split("\\s+"))
                .map(w -> w.replaceAll("[^\\p{L}\\p{M}\\p{N}]", ""))
                .filter(w -> !w.isEmpty())
                .collect(Collectors.toSet());
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(Normalizer.normalize(needle, Normalizer.Form.NFC))) {
                return true;
            }
        }
        return false;
    }
}
