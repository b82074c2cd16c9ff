package com.semantic.ai.registry;

import com.semantic.ai.provider.AiProvider;
import com.semantic.ai.provider.AiProviderFactory;
import com.semantic.common.dto.ConfigurationSummary;
import com.semantic.common.dto.EvaluationOutcome;
import com.semantic.common.dto.ProviderConfig;
import com.semantic.common.dto.ProviderInfo;
import com.semantic.common.dto.ValidationReport;
import com.semantic.dispatcher.pool.ApiKeyPool;
import com.semantic.dispatcher.wait.Waiter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 供应商注册表：按注册顺序保存供应商，维护"当前供应商"，并作为语义比对的统一入口。
 * <p>
 * 注册发生在启动阶段；之后的读取与切换可在任意线程进行。
 */
@Slf4j
public class ProviderRegistry {

    private final AiProviderFactory factory;
    private final Waiter waiter;

    private final Map<String, AiProvider> providers = new LinkedHashMap<>();
    private volatile String currentId;

    public ProviderRegistry(AiProviderFactory factory, Waiter waiter) {
        this.factory = factory;
        this.waiter = waiter;
    }

    /**
     * 创建并注册一个供应商。ID 重复时后注册的覆盖先注册的。
     *
     * @return 供应商 ID，创建失败时为 null（已记录错误日志）
     */
    public String register(ProviderConfig config) {
        AiProvider provider;
        try {
            provider = factory.create(config);
        } catch (RuntimeException e) {
            log.error("创建供应商 {} 失败，已跳过: {}", config.getId(), e.getMessage(), e);
            return null;
        }
        register(provider);
        return provider.getId();
    }

    public synchronized void register(AiProvider provider) {
        AiProvider previous = providers.put(provider.getId(), provider);
        if (previous != null) {
            log.warn("供应商 ID {} 重复注册，已覆盖", provider.getId());
        }
        log.info("注册供应商: {} ({}) - {}", provider.getName(), provider.getId(),
                provider.isConfigured() ? "已配置" : "未配置");
    }

    /**
     * 选择第一个已配置的供应商作为当前供应商；都未配置时选择第一个注册的。
     *
     * @return 选中的供应商 ID，注册表为空时为 null
     */
    public synchronized String autoSelect() {
        currentId = providers.values().stream()
                .filter(AiProvider::isConfigured)
                .map(AiProvider::getId)
                .findFirst()
                .orElseGet(() -> providers.isEmpty() ? null : providers.keySet().iterator().next());
        if (currentId == null) {
            log.warn("未注册任何供应商");
        } else {
            log.info("当前供应商: {}", currentId);
        }
        return currentId;
    }

    /**
     * 切换当前供应商。
     *
     * @return ID 未注册时返回 false，当前供应商保持不变
     */
    public synchronized boolean switchTo(String providerId) {
        AiProvider provider = providerId != null ? providers.get(providerId) : null;
        if (provider == null) {
            log.warn("供应商不存在: {}", providerId);
            return false;
        }
        currentId = providerId;
        log.info("已切换到供应商: {}", provider.getName());
        return true;
    }

    public synchronized Optional<AiProvider> getProvider(String providerId) {
        return Optional.ofNullable(providerId != null ? providers.get(providerId) : null);
    }

    public Optional<AiProvider> getCurrentProvider() {
        return getProvider(currentId);
    }

    public String getCurrentId() {
        return currentId;
    }

    public synchronized List<AiProvider> getProviders() {
        return List.copyOf(providers.values());
    }

    public boolean hasConfiguredProviders() {
        return getProviders().stream().anyMatch(AiProvider::isConfigured);
    }

    /**
     * 供应商选项列表，用于菜单展示："1. Gemini (当前)" 之类。
     */
    public List<String> getProviderChoices() {
        List<String> choices = new ArrayList<>();
        int index = 1;
        for (AiProvider provider : getProviders()) {
            StringBuilder line = new StringBuilder().append(index++).append(". ").append(provider.getName());
            if (!provider.isConfigured()) {
                line.append(" (未配置)");
            }
            if (provider.getId().equals(currentId)) {
                line.append(" (当前)");
            }
            choices.add(line.toString());
        }
        return choices;
    }

    /**
     * 使用指定供应商（为空时使用当前供应商）执行语义比对。永不抛出异常。
     */
    public EvaluationOutcome evaluate(String question, String aiAnswer, String reference,
                                      String providerId, String model) {
        String targetId = providerId != null && !providerId.isBlank() ? providerId : currentId;
        Optional<AiProvider> provider = getProvider(targetId);
        if (provider.isEmpty()) {
            log.warn("指定的供应商不可用: {}", targetId);
            return EvaluationOutcome.error("指定的供应商不可用");
        }
        if (!provider.get().isConfigured()) {
            return EvaluationOutcome.error("供应商 " + provider.get().getName() + " 未正确配置");
        }
        return provider.get().evaluate(question, aiAnswer, reference, model);
    }

    public EvaluationOutcome evaluate(String question, String aiAnswer, String reference) {
        return evaluate(question, aiAnswer, reference, null, null);
    }

    /**
     * 逐个供应商在线验证第一个配置的 Key。未配置的供应商不发请求，直接记为未配置。
     */
    public ValidationReport validationReport() {
        Map<String, ValidationReport.Entry> results = new LinkedHashMap<>();
        int valid = 0;
        int invalid = 0;
        int unconfigured = 0;

        for (AiProvider provider : getProviders()) {
            ApiKeyPool pool = provider.getKeyPool();
            if (!provider.isConfigured() || pool == null) {
                unconfigured++;
                results.put(provider.getId(), entry(provider, ValidationReport.Status.UNCONFIGURED, "未配置 API Key"));
                continue;
            }
            if (provider.validateKey(pool.firstKey())) {
                valid++;
                results.put(provider.getId(), entry(provider, ValidationReport.Status.VALID, "API Key 有效"));
            } else {
                invalid++;
                results.put(provider.getId(), entry(provider, ValidationReport.Status.INVALID, "API Key 无效或网络不可达"));
            }
        }

        log.info("Key 验证完成: {} 通过, {} 失败, {} 未配置", valid, invalid, unconfigured);
        return ValidationReport.builder()
                .results(results)
                .validCount(valid)
                .invalidCount(invalid)
                .unconfiguredCount(unconfigured)
                .build();
    }

    /**
     * 切换到第一个首个 Key 验证通过的已配置供应商。
     *
     * @return 没有任何供应商通过验证时返回 false，当前供应商保持不变
     */
    public boolean switchToFirstValid() {
        for (AiProvider provider : getProviders()) {
            if (firstKeyValid(provider)) {
                return switchTo(provider.getId());
            }
        }
        log.warn("没有通过验证的供应商，当前供应商保持为 {}", currentId);
        return false;
    }

    /**
     * 重新验证所有供应商并按验证结果重新选择当前供应商。
     *
     * @return 验证报告
     */
    public ValidationReport revalidate() {
        ValidationReport report = validationReport();
        for (Map.Entry<String, ValidationReport.Entry> result : report.getResults().entrySet()) {
            if (result.getValue().getStatus() == ValidationReport.Status.VALID) {
                switchTo(result.getKey());
                return report;
            }
        }
        log.warn("重新验证后没有可用的供应商，当前供应商保持为 {}", currentId);
        return report;
    }

    private static boolean firstKeyValid(AiProvider provider) {
        ApiKeyPool pool = provider.getKeyPool();
        if (!provider.isConfigured() || pool == null || pool.isEmpty()) {
            return false;
        }
        return provider.validateKey(pool.firstKey());
    }

    private static ValidationReport.Entry entry(AiProvider provider, ValidationReport.Status status, String message) {
        return ValidationReport.Entry.builder()
                .name(provider.getName())
                .status(status)
                .message(message)
                .build();
    }

    public ConfigurationSummary getConfigurationSummary() {
        List<ProviderInfo> infos = new ArrayList<>();
        for (AiProvider provider : getProviders()) {
            ProviderInfo info = provider.getProviderInfo();
            info.setCurrent(provider.getId().equals(currentId));
            infos.add(info);
        }
        String current = currentId;
        return ConfigurationSummary.builder()
                .total(infos.size())
                .configured((int) infos.stream().filter(ProviderInfo::isConfigured).count())
                .currentId(current)
                .currentName(getCurrentProvider().map(AiProvider::getName).orElse(null))
                .providers(infos)
                .build();
    }

    /**
     * 取消所有正在进行的等待与流式读取，正在执行的比对会以"已取消"错误结束。
     *
     * @return 被取消的等待数
     */
    public int cancelAll() {
        int cancelled = waiter.cancelAll();
        getProviders().forEach(AiProvider::cancel);
        log.info("已取消 {} 个等待中的任务", cancelled);
        return cancelled;
    }
}
