package com.semantic.ai.prompt;

import com.semantic.ai.config.AiProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 语义比对 Prompt 模板集合。
 * <p>
 * 提示词从 classpath 下的 {@code prompts/*.md} 文件加载，修改提示词只需编辑 .md 文件并重启。
 * 配置 {@code semantic.ai.prompt-file} 时，JSON 格式的语义比对提示词改为从该文件读取。
 *
 * <pre>
 * resources/prompts/
 * ├── semantic-check.md   : JSON 格式输出（result / reason）
 * └── labeled-check.md    : 标签行格式输出（判断结果 / 判断依据），iFlow 使用
 * </pre>
 *
 * 模板占位符：{@code {question}}、{@code {ai_answer}}、{@code {source_document}}。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PromptTemplates {

    private static final String PROMPT_DIR = "prompts/";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(question|ai_answer|source_document)\\}");

    private final AiProperties properties;

    private String semanticCheckTemplate;
    private String labeledCheckTemplate;

    @PostConstruct
    public void loadPrompts() {
        String promptFile = properties.getPromptFile();
        if (promptFile != null && !promptFile.isBlank()) {
            semanticCheckTemplate = load(new FileSystemResource(promptFile), promptFile);
            log.info("使用自定义语义比对提示词: {}", promptFile);
        } else {
            semanticCheckTemplate = load(new ClassPathResource(PROMPT_DIR + "semantic-check.md"),
                    PROMPT_DIR + "semantic-check.md");
        }
        labeledCheckTemplate = load(new ClassPathResource(PROMPT_DIR + "labeled-check.md"),
                PROMPT_DIR + "labeled-check.md");

        log.info("已加载 2 个 Prompt 模板");
    }

    /** 要求以 JSON（result / reason）返回的语义比对 Prompt */
    public String semanticCheck(String question, String aiAnswer, String sourceDocument) {
        return fill(semanticCheckTemplate, question, aiAnswer, sourceDocument);
    }

    /** 要求以"判断结果：/判断依据："标签行返回的语义比对 Prompt */
    public String labeledCheck(String question, String aiAnswer, String sourceDocument) {
        return fill(labeledCheckTemplate, question, aiAnswer, sourceDocument);
    }

    private String fill(String template, String question, String aiAnswer, String sourceDocument) {
        if (template == null) {
            throw new IllegalStateException("Prompt 模板尚未加载");
        }
        Map<String, String> values = Map.of(
                "question", nullToEmpty(question),
                "ai_answer", nullToEmpty(aiAnswer),
                "source_document", nullToEmpty(sourceDocument));
        // 一次扫描完成替换，填入的内容里即使含有占位符也不会再被替换
        return PLACEHOLDER.matcher(template)
                .replaceAll(m -> Matcher.quoteReplacement(values.get(m.group(1))));
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    private String load(Resource resource, String name) {
        try {
            String content = resource.getContentAsString(StandardCharsets.UTF_8);
            log.debug("加载 Prompt: {} ({} 字符)", name, content.length());
            return content;
        } catch (IOException e) {
            log.error("加载 Prompt 失败: {}", name, e);
            throw new IllegalStateException("无法加载 Prompt 文件: " + name, e);
        }
    }
}
