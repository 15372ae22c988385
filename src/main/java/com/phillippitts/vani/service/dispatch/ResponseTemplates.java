package com.phillippitts.vani.service.dispatch;

import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.Language;
import com.phillippitts.vani.domain.Slots;
import com.phillippitts.vani.domain.SystemStatus;
import com.phillippitts.vani.domain.VolumeDirection;

import java.util.Locale;
import java.util.Objects;

/**
 * Localized response texts. Every method returns text in the requested language only.
 */
public final class ResponseTemplates {

    private final DispatchSettings settings;

    public ResponseTemplates(DispatchSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public String identity(Language language) {
        String name = settings.nameIn(language);
        return pick(language,
                "I am " + name + ", your multilingual AI voice assistant. "
                        + "I can help you in English, Hindi, and Gujarati!",
                "मैं " + name + " हूं, आपकी बहुभाषी AI आवाज सहायक। "
                        + "मैं अंग्रेजी, हिंदी और गुजराती में आपकी मदद कर सकती हूं!",
                "હું " + name + " છું, તમારી બહુભાષી AI વૉઇસ આસિસ્ટન્ટ. "
                        + "હું અંગ્રેજી, હિન્દી અને ગુજરાતીમાં તમારી મદદ કરી શકું છું!");
    }

    public String goodbye(Language language) {
        String name = settings.nameIn(language);
        return pick(language,
                "Goodbye! " + name + " signing off.",
                "अलविदा! " + name + " विदा ले रही है।",
                "આવજો! " + name + " જતી રહી છે.");
    }

    public String historyCleared(Language language) {
        return pick(language, "Conversation history cleared", "बातचीत का इतिहास साफ़ हो गया",
                "વાતચીત ઇતિહાસ સાફ થયો");
    }

    public String emptyUtterance(Language language) {
        return pick(language, "I didn't catch that. Please say it again.",
                "मैं सुन नहीं पाई। कृपया फिर से बोलें।",
                "હું સાંભળી શકી નહીં. કૃપા કરીને ફરીથી બોલો.");
    }

    public String couldNotHear(Language language) {
        return pick(language, "I couldn't hear that. Please try again.",
                "मैं वह सुन नहीं सकी। कृपया फिर से कोशिश करें।",
                "હું તે સાંભળી શકી નહીં. કૃપા કરીને ફરી પ્રયાસ કરો.");
    }

    public String visionDescription(Language language, String description) {
        return pick(language, "I can see: ", "मैं देख रहा हूं: ", "હું જોઈ રહ્યો છું: ") + description;
    }

    public String cameraUnavailable(Language language) {
        return pick(language, "I cannot access the camera right now", "मैं कैमरा एक्सेस नहीं कर पा रहा हूं",
                "હું કેમેરાને ઍક્સેસ કરી શકતો નથી");
    }

    public String staleVision(Language language) {
        return pick(language, "I no longer remember what I saw. Please ask me to look again.",
                "मुझे अब याद नहीं कि मैंने क्या देखा था। कृपया मुझे फिर से देखने को कहें।",
                "મને હવે યાદ નથી કે મેં શું જોયું હતું. કૃપા કરીને મને ફરીથી જોવા કહો.");
    }

    public String openedApplication(Language language, String application) {
        return pick(language, "Opening " + application, application + " खोल दिया", application + " ખોલ્યું");
    }

    public String closedApplication(Language language, String application) {
        return pick(language, "Closed " + application, application + " बंद कर दिया", application + " બંધ કર્યું");
    }

    public String openedWebsite(Language language, String site) {
        return pick(language, "Opening " + site, site + " खोल रहा हूं", site + " ખોલી રહ્યો છું");
    }

    public String screenshotSaved(Language language, String location) {
        return pick(language, "Screenshot saved to " + location, "स्क्रीनशॉट यहाँ सहेजा: " + location,
                "સ્ક્રીનશોટ અહીં સાચવ્યો: " + location);
    }

    public String systemStatus(Language language, SystemStatus status) {
        String cpu = "CPU: " + percent(status.cpuPercent());
        String battery = status.hasBattery()
                ? status.batteryPercent() + "% (" + pick(language,
                        status.charging() ? "charging" : "on battery",
                        status.charging() ? "चार्ज हो रही है" : "बैटरी पर",
                        status.charging() ? "ચાર્જ થઈ રહી છે" : "બેટરી પર") + ")"
                : "N/A";
        String memory = percent(status.memoryPercent());
        return pick(language,
                cpu + "\nMemory: " + memory + "\nBattery: " + battery,
                cpu + "\nमेमोरी: " + memory + "\nबैटरी: " + battery,
                cpu + "\nમેમરી: " + memory + "\nબેટરી: " + battery);
    }

    public String volume(Language language, VolumeDirection direction) {
        return switch (direction) {
            case UP -> pick(language, "Volume increased", "आवाज़ बढ़ा दी", "અવાજ વધાર્યો");
            case DOWN -> pick(language, "Volume decreased", "आवाज़ कम कर दी", "અવાજ ઘટાડ્યો");
            case MUTE -> pick(language, "Volume muted", "आवाज़ बंद कर दी", "અવાજ બંધ કર્યો");
        };
    }

    public String searchResults(Language language, String summary) {
        return pick(language, "Here is what I found: ", "मुझे यह मिला: ", "મને આ મળ્યું: ") + summary;
    }

    public String notFound(Language language) {
        return pick(language, "I couldn't find information about that",
                "मुझे इसके बारे में जानकारी नहीं मिली", "મને તેના વિશે માહિતી મળી નહીં");
    }

    public String couldNotProcess(Language language) {
        return pick(language, "I'm sorry, I couldn't process that", "क्षमा करें, मैं इसे संसाधित नहीं कर सका",
                "માફ કરશો, હું તેને પ્રક્રિયા કરી શક્યો નહીં");
    }

    public String timedOut(Language language) {
        return pick(language, "That took too long. Please try again.",
                "इसमें बहुत समय लगा। कृपया फिर से कोशिश करें।",
                "આમાં ઘણો સમય લાગ્યો. કૃપા કરીને ફરી પ્રયાસ કરો.");
    }

    public String deviceBusy(Language language) {
        return pick(language, "That device is busy right now. Please try again.",
                "वह डिवाइस अभी व्यस्त है। कृपया फिर से कोशिश करें।",
                "તે ઉપકરણ હમણાં વ્યસ્ત છે. કૃપા કરીને ફરી પ્રયાસ કરો.");
    }

    public String cancelled(Language language) {
        return pick(language, "Cancelled.", "रद्द किया गया।", "રદ કર્યું.");
    }

    /**
     * Clarifying question for the first missing slot of an intent.
     */
    public String clarify(Language language, Intent intent, String slot) {
        return switch (slot) {
            case Slots.APP -> intent == Intent.CLOSE_APP
                    ? pick(language, "Which application should I close?", "कौन सा एप्लिकेशन बंद करूं?",
                            "કઈ એપ્લિકેશન બંધ કરું?")
                    : pick(language, "Which application should I open?", "कौन सा एप्लिकेशन खोलूं?",
                            "કઈ એપ્લિકેશન ખોલું?");
            case Slots.SITE -> pick(language, "Which website should I open?", "कौन सी वेबसाइट खोलूं?",
                    "કઈ વેબસાઇટ ખોલું?");
            case Slots.BROWSER -> pick(language, "Which browser should I use?", "कौन सा ब्राउज़र इस्तेमाल करूं?",
                    "કયું બ્રાઉઝર વાપરું?");
            case Slots.DIRECTION -> pick(language, "Should I turn the volume up or down, or mute it?",
                    "आवाज़ बढ़ाऊं, कम करूं या म्यूट करूं?", "અવાજ વધારું, ઘટાડું કે મ્યૂટ કરું?");
            case Slots.QUERY -> pick(language, "What should I look up?", "मैं क्या खोजूं?", "હું શું શોધું?");
            default -> couldNotProcess(language);
        };
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }

    private static String pick(Language language, String english, String hindi, String gujarati) {
        return switch (language) {
            case ENGLISH -> english;
            case HINDI -> hindi;
            case GUJARATI -> gujarati;
        };
    }
}
