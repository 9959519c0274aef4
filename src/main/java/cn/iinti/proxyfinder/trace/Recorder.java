package cn.iinti.proxyfinder.trace;


import com.google.common.base.Splitter;
import com.google.common.base.Throwables;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * 流水线事件记录器，所有抓取、探测、轮换过程的日志都通过它输出。
 * 消息使用{@link MessageGetter}延迟构造，被采样丢弃的日志不会产生字符串拼接开销
 */
public abstract class Recorder {

    private static final Splitter lineSplitter = Splitter.on('\n').omitEmptyStrings();

    public void recordEvent(String message) {
        recordEvent(() -> message, (Throwable) null);
    }

    public void recordEvent(String message, Throwable throwable) {
        recordEvent(() -> message, throwable);
    }

    public void recordEvent(MessageGetter messageGetter) {
        recordEvent(messageGetter, (Throwable) null);
    }

    public abstract void recordEvent(MessageGetter messageGetter, Throwable throwable);

    protected List<String> splitMsg(String msg, Throwable throwable) {
        List<String> strings = Lists.newArrayList(lineSplitter.split(msg == null ? "" : msg));
        if (throwable == null) {
            return strings;
        }
        strings.addAll(lineSplitter.splitToList(Throwables.getStackTraceAsString(throwable)));
        return strings;
    }

    public interface MessageGetter {
        String getMessage();
    }

    public static final Recorder nop = new Recorder() {
        @Override
        public void recordEvent(MessageGetter messageGetter, Throwable throwable) {

        }
    };
}
