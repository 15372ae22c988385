package com.phillippitts.vani.service.dispatch;

import com.phillippitts.vani.domain.ConversationTurn;
import com.phillippitts.vani.domain.Language;
import com.phillippitts.vani.domain.SearchContext;
import com.phillippitts.vani.domain.Speaker;
import com.phillippitts.vani.domain.VisionContext;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders prompts for the conversation model.
 *
 * <p>Layout: per-language system instruction, optional camera and search blocks, replayed
 * history as {@code User:}/{@code Assistant:} lines, the current user line, and a trailing
 * {@code Assistant: } cue.
 */
public final class PromptBuilder {

    private final DispatchSettings settings;

    public PromptBuilder(DispatchSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Keeps only turns written in {@code language}, preserving order.
     */
    public static List<ConversationTurn> sameLanguage(List<ConversationTurn> turns, Language language) {
        return turns.stream().filter(t -> t.language() == language).collect(Collectors.toList());
    }

    public String conversation(String userText,
                               Language language,
                               List<ConversationTurn> history,
                               Optional<VisionContext> vision,
                               Optional<SearchContext> search) {
        StringBuilder sb = new StringBuilder(systemInstruction(language)).append("\n\n");
        vision.ifPresent(v -> sb.append(visionBlock(language, v.description())).append("\n\n"));
        search.ifPresent(s -> sb.append(searchBlock(language, s)).append("\n\n"));
        return appendDialogue(sb, userText, history);
    }

    /**
     * Prompt for a follow-up about the last captured frame ("what color is it?").
     */
    public String visionFollowUp(String userText, Language language, List<ConversationTurn> history,
                                 VisionContext vision) {
        String instruction = switch (language) {
            case ENGLISH -> "You are a helpful AI assistant with access to visual information.";
            case HINDI -> "तुम एक सहायक AI हो जो दृश्य जानकारी को समझ सकता है।";
            case GUJARATI -> "તમે એક સહાયક AI છો જે દ્રશ્ય માહિતી સમજી શકે છે.";
        };
        StringBuilder sb = new StringBuilder(instruction).append("\n\n");
        sb.append(visionBlock(language, vision.description())).append("\n\n");
        return appendDialogue(sb, userText, history);
    }

    String systemInstruction(Language language) {
        String name = settings.nameIn(language);
        return switch (language) {
            case ENGLISH -> "You are " + name + ", a helpful AI voice assistant with web search capability.\n"
                    + "Respond ONLY in clear, natural English. Keep responses brief and conversational.\n"
                    + "If web search results are provided, use them to give accurate, up-to-date information.";
            case HINDI -> "तुम " + name + " हो, एक सहायक AI असिस्टेंट जो वेब खोज कर सकती है।\n"
                    + "केवल हिंदी में जवाब दो। संक्षिप्त और स्पष्ट उत्तर दो। अंग्रेजी का प्रयोग बिल्कुल न करें।\n"
                    + "अगर वेब खोज परिणाम दिए गए हैं, तो उनका उपयोग करके सटीक जानकारी दें।";
            case GUJARATI -> "તમે " + name + " છો, એક સહાયક AI આસિસ્ટન્ટ જે વેબ શોધ કરી શકે છે.\n"
                    + "ફક્ત ગુજરાતીમાં જવાબ આપો. સંક્ષિપ્ત અને સ્પષ્ટ જવાબો આપો. અંગ્રેજીનો ઉપયોગ ન કરો.\n"
                    + "જો વેબ શોધ પરિણામો આપવામાં આવે છે, તો તેનો ઉપયોગ કરીને સચોટ માહિતી આપો.";
        };
    }

    private static String visionBlock(Language language, String description) {
        String label = switch (language) {
            case ENGLISH -> "Visual information (from camera): ";
            case HINDI -> "दृश्य जानकारी (कैमरा): ";
            case GUJARATI -> "દ્રશ્ય માહિતી (કેમેરા): ";
        };
        return label + description;
    }

    private static String searchBlock(Language language, SearchContext search) {
        String header = switch (language) {
            case ENGLISH -> "Search Results:";
            case HINDI -> "इंटरनेट खोज परिणाम:";
            case GUJARATI -> "ઇન્ટરનેટ શોધ પરિણામો:";
        };
        return header + "\n" + search.query() + ": " + search.result()
                + "\n\nUse the above web search information to answer the question.";
    }

    private static String appendDialogue(StringBuilder sb, String userText, List<ConversationTurn> history) {
        for (ConversationTurn turn : history) {
            sb.append(turn.speaker() == Speaker.USER ? "User: " : "Assistant: ").append(turn.text()).append('\n');
        }
        sb.append("User: ").append(userText).append('\n');
        sb.append("Assistant: ");
        return sb.toString();
    }
}
