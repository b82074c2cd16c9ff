package com.semantic.config;

import com.semantic.ai.registry.ProviderRegistry;
import com.semantic.common.dto.ConfigurationSummary;
import com.semantic.common.dto.ProviderInfo;
import com.semantic.common.dto.ValidationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 应用启动时输出供应商配置概况。
 * <p>
 * 没有任何供应商配置 Key 时输出醒目警告；
 * 开启 {@code semantic.app.validate-on-startup} 时对每个已配置供应商在线验证一次 Key。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderStartupReporter implements CommandLineRunner {

    private final ProviderRegistry registry;

    @Value("${semantic.app.validate-on-startup:false}")
    private boolean validateOnStartup;

    @Override
    public void run(String... args) {
        ConfigurationSummary summary = registry.getConfigurationSummary();

        if (!registry.hasConfiguredProviders()) {
            log.warn("==============================================");
            log.warn("  未配置任何 AI 供应商的 API Key！");
            log.warn("  请在 application.yml 的 semantic.ai.providers 中设置，");
            log.warn("  或通过环境变量: GEMINI_API_KEYS / OPENAI_API_KEYS /");
            log.warn("  ANTHROPIC_API_KEYS / DIFY_API_KEY / IFLOW_API_KEY");
            log.warn("==============================================");
            return;
        }

        log.info("已配置 {}/{} 个供应商，当前: {}", summary.getConfigured(), summary.getTotal(), summary.getCurrentName());
        for (ProviderInfo info : summary.getProviders()) {
            log.info("  {} [{}] {} 个 Key，默认模型 {}{}", info.getName(), info.getId(), info.getKeyCount(),
                    info.getDefaultModel(), info.isCurrent() ? " (当前)" : "");
        }

        if (validateOnStartup) {
            report(registry.validationReport());
        }
    }

    private void report(ValidationReport report) {
        for (Map.Entry<String, ValidationReport.Entry> e : report.getResults().entrySet()) {
            ValidationReport.Entry entry = e.getValue();
            if (entry.getStatus() == ValidationReport.Status.INVALID) {
                log.warn("  {}: {} - {}", entry.getName(), entry.getStatus().getLabel(), entry.getMessage());
            } else {
                log.info("  {}: {} - {}", entry.getName(), entry.getStatus().getLabel(), entry.getMessage());
            }
        }
    }
}
