package com.github.salilvnair.dialogengine.template;

import com.github.salilvnair.dialogengine.engine.memory.DialogMemory;
import com.github.salilvnair.dialogengine.engine.memory.MemoryScope;
import org.thymeleaf.context.Context;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders outbound text in Thymeleaf TEXT mode.
 * <p>
 * {@code {user.name}} and {@code {{user.name}}} are memory paths, resolved through
 * {@link DialogMemory} so missing values render empty. {@code #{expr}}, {@code [${expr}]}
 * and {@code [[${expr}]]} are Thymeleaf expressions over the scope maps.
 */
public class ThymeleafLanguageGenerator implements LanguageGenerator {

    private static final String PATH = "([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z0-9_]+|\\[[^\\]{}]+])*)";
    private static final Pattern LEGACY_VAR_PATTERN = Pattern.compile("\\{\\{\\s*" + PATH + "\\s*}}");
    private static final Pattern LEGACY_EXPR_PATTERN = Pattern.compile("#\\{\\s*([^{}]+?)\\s*}");
    private static final Pattern SINGLE_BRACKET_EXPR_PATTERN = Pattern.compile("(?<!\\[)\\[\\s*\\$\\{\\s*([^{}]+?)\\s*}\\s*](?!])");
    private static final Pattern MEMORY_PATH_PATTERN = Pattern.compile("(?<![$#{])\\{\\s*" + PATH + "\\s*}(?!})");

    private static final String VARIABLE_PREFIX = "lgValue";

    private final SpringTemplateEngine templateEngine;

    public ThymeleafLanguageGenerator() {
        StringTemplateResolver resolver = new StringTemplateResolver();
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCacheable(false);

        SpringTemplateEngine engine = new SpringTemplateEngine();
        engine.setTemplateResolver(resolver);
        engine.setEnableSpringELCompiler(true);
        this.templateEngine = engine;
    }

    @Override
    public String resolve(String template, DialogMemory memory) {
        String raw = template == null ? "" : template;
        if (raw.isBlank()) {
            return raw;
        }
        Map<String, Object> variables = new LinkedHashMap<>(memory.scopes());
        String normalized = bindPaths(raw, LEGACY_VAR_PATTERN, memory, variables);
        normalized = replacePattern(normalized, LEGACY_EXPR_PATTERN, "[[${$1}]]");
        normalized = replacePattern(normalized, SINGLE_BRACKET_EXPR_PATTERN, "[[${$1}]]");
        normalized = bindPaths(normalized, MEMORY_PATH_PATTERN, memory, variables);

        Context context = new Context();
        context.setVariables(variables);
        String rendered = templateEngine.process(normalized, context);
        return rendered == null ? "" : rendered;
    }

    private String bindPaths(String input, Pattern pattern, DialogMemory memory, Map<String, Object> variables) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String path = matcher.group(1).trim();
            String replacement;
            if (isMemoryPath(path)) {
                String variable = VARIABLE_PREFIX + variables.size();
                variables.put(variable, memory.get(path));
                replacement = "[[${" + variable + "}]]";
            }
            else {
                replacement = matcher.group();
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private boolean isMemoryPath(String path) {
        int end = 0;
        while (end < path.length() && path.charAt(end) != '.' && path.charAt(end) != '[') {
            end++;
        }
        return end < path.length() && MemoryScope.fromPrefix(path.substring(0, end)).isPresent();
    }

    private String replacePattern(String input, Pattern pattern, String replacement) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String resolvedReplacement = replacement.replace("$1", matcher.group(1).trim());
            matcher.appendReplacement(out, Matcher.quoteReplacement(resolvedReplacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
