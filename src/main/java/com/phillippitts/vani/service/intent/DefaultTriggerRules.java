package com.phillippitts.vani.service.intent;

import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.Language;

import static com.phillippitts.vani.domain.Language.ENGLISH;
import static com.phillippitts.vani.domain.Language.GUJARATI;
import static com.phillippitts.vani.domain.Language.HINDI;

/**
 * Trigger phrases shipped with the assistant, for English, Hindi and Gujarati.
 *
 * <p>Hindi and Gujarati are verb-final, so their application and website phrases put the
 * entity before the verb ("फ़ायरफ़ॉक्स बंद करो").
 */
public final class DefaultTriggerRules {

    private DefaultTriggerRules() {
    }

    public static TriggerRuleTable create(EntityCatalog catalog) {
        TriggerRuleTable.Builder b = TriggerRuleTable.builder(catalog);
        control(b);
        vision(b);
        desktop(b);
        system(b);
        information(b);
        return b.build();
    }

    private static void control(TriggerRuleTable.Builder b) {
        b.commands(ENGLISH, Intent.EXIT, "^exit$", "^quit$", "^stop$", "^bye$", "goodbye", "bye bye")
         .commands(HINDI, Intent.EXIT, "बाहर निकलें", "^बंद करो$", "अलविदा", "बाय", "^रुको$")
         .commands(GUJARATI, Intent.EXIT, "બહાર નીકળો", "^બંધ કરો$", "અલવિદા", "બાય");

        b.commands(ENGLISH, Intent.RESET, "reset", "clear history", "clear the history", "start over",
                        "forget everything")
         .commands(HINDI, Intent.RESET, "रीसेट", "इतिहास साफ़ करें", "इतिहास साफ़ करो", "इतिहास साफ करो",
                        "फिर से शुरू करो")
         .commands(GUJARATI, Intent.RESET, "રીસેટ", "ઇતિહાસ સાફ કરો", "ફરીથી શરૂ કરો");

        b.commands(ENGLISH, Intent.IDENTITY, "who are you", "what is your name", "your name")
         .commands(HINDI, Intent.IDENTITY, "तुम कौन हो", "आप कौन हैं", "आप कौन हो", "तुम्हारा नाम क्या है",
                        "आपका नाम क्या है")
         .commands(GUJARATI, Intent.IDENTITY, "તમે કોણ છો", "તમારું નામ શું છે", "તમારું નામ");
    }

    private static void vision(TriggerRuleTable.Builder b) {
        b.keywords(ENGLISH, Intent.VISION,
                "what do you see", "what can you see", "what * see", "describe what you see",
                "tell me what you see", "look at", "take a look", "camera",
                "how many people", "how many persons", "is there a person", "are there people", "anyone here",
                "what object", "how many objects", "count the", "what is in front",
                "what color", "what colour", "color of", "colour of",
                "where am i", "what room", "what place",
                "describe this", "what is this", "read this", "read the text", "what does it say", "clock");
        b.keywords(HINDI, Intent.VISION,
                "क्या दिख रहा है", "क्या देख रहा है", "क्या देख रहे हो", "क्या दीख रहा है", "क्या देख रही हो",
                "क्या दिखाई दे रहा है",
                "देखो", "दिखाओ", "यह क्या है", "ये क्या है", "कैमरा", "कैमरे से देखो",
                "कितने लोग", "कितने व्यक्ति", "कोई व्यक्ति", "क्या वस्तु", "कितनी वस्तु",
                "क्या रंग", "रंग कैसा", "रंग क्या", "कौन सा रंग", "कहाँ हूँ", "कौन सा कमरा",
                "पढ़ो", "क्या लिखा है", "घड़ी");
        b.keywords(GUJARATI, Intent.VISION,
                "તમે શું જુઓ છો", "શું દેખાય છે", "શું જોવા મળે છે", "જુઓ", "દેખાવો",
                "આ શું છે", "એ શું છે", "કેમેરા", "કેમેરાથી જુઓ",
                "કેટલા લોકો", "કોઈ વ્યક્તિ", "શું વસ્તુ", "કેટલી વસ્તુ",
                "કયો રંગ", "રંગ શું", "ક્યાં છું", "વાંચો", "શું લખ્યું છે", "ઘડિયાળ");
    }

    private static void desktop(TriggerRuleTable.Builder b) {
        b.commands(ENGLISH, Intent.OPEN_WEBSITE,
                "open [the] <site>", "open [the] <site> in <browser>", "open [the] <site> on <browser>",
                "go to <site>", "visit <site>", "browse <site>", "open [the|a] website")
         .commands(HINDI, Intent.OPEN_WEBSITE,
                "<site> खोलो", "<site> खोल दो", "<browser> में <site> खोलो", "<site> पर जाओ", "वेबसाइट खोलो")
         .commands(GUJARATI, Intent.OPEN_WEBSITE,
                "<site> ખોલો", "<browser> માં <site> ખોલો", "<site> પર જાઓ", "વેબસાઇટ ખોલો");

        b.commands(ENGLISH, Intent.OPEN_APP,
                "open [the|my] <app>", "launch [the|my] <app>", "start [the|my] <app>", "run [the|my] <app>",
                "open [an|the] application", "open [an|the] app",
                "launch [an|the] application", "launch [an|the] app")
         .commands(HINDI, Intent.OPEN_APP,
                "<app> खोलो", "<app> खोल दो", "<app> चालू करो", "<app> शुरू करो", "ऐप खोलो", "एप्लिकेशन खोलो")
         .commands(GUJARATI, Intent.OPEN_APP,
                "<app> ખોલો", "<app> ચાલુ કરો", "<app> શરૂ કરો", "એપ ખોલો", "એપ્લિકેશન ખોલો");

        b.commands(ENGLISH, Intent.CLOSE_APP,
                "close [the|my] <app>", "quit <app>", "exit <app>", "kill <app>", "stop <app>",
                "shut down <app>", "close [an|the] application", "close [an|the] app")
         .commands(HINDI, Intent.CLOSE_APP,
                "<app> बंद करो", "<app> बंद कर दो", "ऐप बंद करो", "एप्लिकेशन बंद करो")
         .commands(GUJARATI, Intent.CLOSE_APP,
                "<app> બંધ કરો", "એપ બંધ કરો", "એપ્લિકેશન બંધ કરો");

        // Unknown targets still resolve to the app intents so the extractor can ask which one.
        b.catchAll(ENGLISH, Intent.OPEN_APP,
                "^open [the|my] <target>$", "^launch [the|my] <target>$", "^start [the|my] <target>$",
                "^run [the|my] <target>$")
         .catchAll(HINDI, Intent.OPEN_APP, "^<target> खोलो$", "^<target> खोल दो$", "^<target> चालू करो$")
         .catchAll(GUJARATI, Intent.OPEN_APP, "^<target> ખોલો$", "^<target> ચાલુ કરો$");

        b.catchAll(ENGLISH, Intent.CLOSE_APP,
                "^close [the|my] <target>$", "^quit [the|my] <target>$", "^exit [the|my] <target>$",
                "^kill [the|my] <target>$")
         .catchAll(HINDI, Intent.CLOSE_APP, "^<target> बंद करो$", "^<target> बंद कर दो$")
         .catchAll(GUJARATI, Intent.CLOSE_APP, "^<target> બંધ કરો$");
    }

    private static void system(TriggerRuleTable.Builder b) {
        b.commands(ENGLISH, Intent.SCREENSHOT, "screenshot", "screen shot", "capture the screen",
                        "capture my screen")
         .commands(HINDI, Intent.SCREENSHOT, "स्क्रीनशॉट", "स्क्रीन शॉट")
         .commands(GUJARATI, Intent.SCREENSHOT, "સ્ક્રીનશોટ", "સ્ક્રીન શોટ");

        b.commands(ENGLISH, Intent.SYSTEM_STATUS, "system status", "system info", "system information",
                        "battery", "cpu usage", "memory usage")
         .commands(HINDI, Intent.SYSTEM_STATUS, "बैटरी", "सिस्टम की स्थिति", "सिस्टम")
         .commands(GUJARATI, Intent.SYSTEM_STATUS, "બેટરી", "સિસ્ટમ");

        b.keywords(ENGLISH, Intent.VOLUME_CONTROL, "volume", "mute", "louder", "quieter")
         .keywords(HINDI, Intent.VOLUME_CONTROL, "आवाज़", "आवाज", "वॉल्यूम", "म्यूट")
         .keywords(GUJARATI, Intent.VOLUME_CONTROL, "અવાજ", "વોલ્યુમ", "મ્યૂટ");
    }

    private static void information(TriggerRuleTable.Builder b) {
        b.commands(ENGLISH, Intent.WEB_SEARCH, "search the web for", "search online for", "search for",
                        "search", "look up", "find", "google")
         .keywords(ENGLISH, Intent.WEB_SEARCH, "latest news", "news about", "weather today", "news", "latest",
                        "recent", "happening", "weather", "temperature", "forecast", "price", "stock", "score",
                        "who won", "what happened")
         .commands(HINDI, Intent.WEB_SEARCH, "सर्च करो", "सर्च", "खोजें", "खोजो", "ढूंढें", "ढूंढो")
         .keywords(HINDI, Intent.WEB_SEARCH, "समाचार", "ख़बर", "खबर", "ताज़ा", "मौसम", "तापमान", "कीमत",
                        "स्टॉक", "क्या हुआ")
         .commands(GUJARATI, Intent.WEB_SEARCH, "સર્ચ કરો", "શોધો", "શોધ")
         .keywords(GUJARATI, Intent.WEB_SEARCH, "સમાચાર", "તાજા", "હવામાન", "કિંમત", "સ્ટોક", "શું થયું");

        b.commands(ENGLISH, Intent.KNOWLEDGE, "tell me about", "definition of", "meaning of", "history of",
                        "what is", "what's", "what are", "who is", "who was", "explain")
         .commands(HINDI, Intent.KNOWLEDGE, "के बारे में", "का मतलब", "क्या है", "कौन है", "कौन था",
                        "बताओ", "बताइए", "समझाओ")
         .commands(GUJARATI, Intent.KNOWLEDGE, "વિશે જણાવો", "વિશે", "શું છે", "કોણ છે", "જણાવો", "સમજાવો");
    }
}
