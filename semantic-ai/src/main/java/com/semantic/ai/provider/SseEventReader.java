package com.semantic.ai.provider;

import com.semantic.common.exception.OperationCancelledException;
import com.semantic.dispatcher.wait.CancellationSignal;
import okio.BufferedSource;

import java.io.IOException;

/**
 * 逐行读取 Server-Sent Events 流。每读一行前检查停止令牌。
 */
final class SseEventReader {

    /**
     * 事件回调。
     */
    interface EventHandler {

        /**
         * @param event 最近一次 {@code event:} 行的值，未声明时为 null
         * @param data  {@code data:} 行的内容
         * @return false 表示已收到终止标记，停止读取
         */
        boolean onEvent(String event, String data);
    }

    private SseEventReader() {
    }

    /**
     * @return true 表示读到终止标记，false 表示流自然结束
     */
    static boolean read(BufferedSource source, CancellationSignal.Token token, EventHandler handler) throws IOException {
        String event = null;
        while (!source.exhausted()) {
            if (token.isCancelled()) {
                throw new OperationCancelledException("流式读取已停止");
            }
            String line = source.readUtf8Line();
            if (line == null) {
                break;
            }
            if (line.isEmpty()) {
                event = null;
                continue;
            }
            if (line.startsWith("event:")) {
                event = line.substring(6).trim();
                continue;
            }
            if (!line.startsWith("data:")) {
                continue;
            }
            String data = line.substring(5).trim();
            if (!handler.onEvent(event, data)) {
                return true;
            }
        }
        if (token.isCancelled()) {
            throw new OperationCancelledException("流式读取已停止");
        }
        return false;
    }
}
