package com.semantic.ai.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.semantic.ai.config.AiProperties;
import com.semantic.ai.parse.ResponseNormalizer;
import com.semantic.ai.prompt.PromptTemplates;
import com.semantic.common.dto.ProviderConfig;
import com.semantic.dispatcher.config.DispatcherProperties;
import com.semantic.dispatcher.pool.KeyPoolFactory;
import com.semantic.dispatcher.retry.RetryOrchestrator;
import com.semantic.dispatcher.wait.Waiter;
import okhttp3.OkHttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 供应商测试的公共装配：不真正等待的 Waiter、短超时的 HTTP 客户端、零间隔的 Key 池。
 */
final class ProviderTestSupport {

    private ProviderTestSupport() {
    }

    static final class InstantWaiter implements Waiter {

        final List<Duration> waits = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void await(Duration delay, String reason) {
            if (delay != null && !delay.isZero() && !delay.isNegative()) {
                waits.add(delay);
            }
        }

        @Override
        public int cancelAll() {
            return 0;
        }
    }

    static ProviderContext context(Waiter waiter) {
        DispatcherProperties dispatcher = new DispatcherProperties();
        dispatcher.setMinKeySpacing(Duration.ZERO);

        AiProperties ai = new AiProperties();
        PromptTemplates templates = new PromptTemplates(ai);
        templates.loadPrompts();

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(5))
                .readTimeout(Duration.ofSeconds(5))
                .build();

        return new ProviderContext(client, new ObjectMapper(), ai, templates, new ResponseNormalizer(),
                new RetryOrchestrator(dispatcher, waiter),
                new KeyPoolFactory(dispatcher, Clock.systemUTC(), waiter));
    }

    static AiProvider create(ProviderConfig config) {
        return new AiProviderFactory(context(new InstantWaiter())).create(config);
    }

    static String geminiResponse(String text) {
        return "{\"candidates\":[{\"content\":{\"role\":\"model\",\"parts\":[{\"text\":"
                + quote(text) + "}]}}]}";
    }

    static String openAiResponse(String text) {
        return "{\"id\":\"chatcmpl-1\",\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":"
                + quote(text) + "},\"finish_reason\":\"stop\"}]}";
    }

    static String quote(String text) {
        try {
            return new ObjectMapper().writeValueAsString(text);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
