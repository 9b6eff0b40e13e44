package com.github.salilvnair.dialogengine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "dialogengine")
@Getter
@Setter
public class DialogEngineConfig {

    private int maxStepsPerTurn = 1000;
    private String defaultLocale = "en-us";
    private boolean sendTrace = false;
    private Recognizer recognizer = new Recognizer();
    private Map<String, ChoiceFormat> choiceFormats = defaultChoiceFormats();

    @Getter
    @Setter
    public static class Recognizer {
        private double minScore = 0.5d;
    }

    @Getter
    @Setter
    public static class ChoiceFormat {
        private String inlineSeparator = ", ";
        private String inlineOr = " or ";
        private String inlineOrMore = ", or ";
        private boolean includeNumbers = true;
        private String yes = "Yes";
        private String no = "No";
        private List<String> yesWords = new ArrayList<>();
        private List<String> noWords = new ArrayList<>();

        static ChoiceFormat of(String separator, String or, String orMore, String yes, String no,
                               List<String> yesWords, List<String> noWords) {
            ChoiceFormat format = new ChoiceFormat();
            format.setInlineSeparator(separator);
            format.setInlineOr(or);
            format.setInlineOrMore(orMore);
            format.setYes(yes);
            format.setNo(no);
            format.setYesWords(new ArrayList<>(yesWords));
            format.setNoWords(new ArrayList<>(noWords));
            return format;
        }
    }

    private static Map<String, ChoiceFormat> defaultChoiceFormats() {
        Map<String, ChoiceFormat> defaults = new LinkedHashMap<>();
        defaults.put("en", ChoiceFormat.of(", ", " or ", ", or ", "Yes", "No",
                List.of("yes", "y", "yeah", "yep", "sure", "ok", "true"),
                List.of("no", "n", "nope", "nah", "false")));
        defaults.put("es", ChoiceFormat.of(", ", " o ", ", o ", "Sí", "No",
                List.of("sí", "si", "s"), List.of("no", "n")));
        defaults.put("nl", ChoiceFormat.of(", ", " of ", ", of ", "Ja", "Nee",
                List.of("ja", "j"), List.of("nee", "n")));
        defaults.put("fr", ChoiceFormat.of(", ", " ou ", ", ou ", "Oui", "Non",
                List.of("oui", "o"), List.of("non", "n")));
        defaults.put("pt", ChoiceFormat.of(", ", " ou ", ", ou ", "Sim", "Não",
                List.of("sim", "s"), List.of("não", "nao", "n")));
        defaults.put("de", ChoiceFormat.of(", ", " oder ", ", oder ", "Ja", "Nein",
                List.of("ja", "j"), List.of("nein", "n")));
        defaults.put("ja", ChoiceFormat.of("、 ", " または ", "、 または ", "はい", "いいえ",
                List.of("はい"), List.of("いいえ")));
        defaults.put("zh", ChoiceFormat.of("， ", " 要么 ", "， 要么 ", "是的", "不",
                List.of("是的", "是"), List.of("不", "不是")));
        return defaults;
    }
}
