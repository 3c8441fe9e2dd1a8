package service.route.impl;

import common.consts.RouteErrorTypeEnum;
import lombok.Data;
import model.dto.response.RouteError;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 路线规划错误日志
 * 记录最近的失败请求与未预期的异常，供调用方查询
 */
@Component
public class RouteErrorLog {

    private static final int DEFAULT_CAPACITY = 500;

    private final Deque<ErrorLogEntry> errorBuffer = new ArrayDeque<>(DEFAULT_CAPACITY);

    /**
     * 记录规划失败
     */
    public synchronized void recordRouteFailure(RouteError error, String startLocation, int missionCount) {
        ErrorLogEntry entry = newEntry();
        entry.setErrorType(error.getType());
        entry.setMessage(error.getError());
        entry.setStartLocation(startLocation);
        entry.setMissionCount(missionCount);
        entry.setRemainingMissions(error.getRemainingMissions());
        addEntry(entry);
    }

    /**
     * 记录请求处理中的未预期异常
     */
    public synchronized void recordUnexpectedError(String message, Throwable cause) {
        ErrorLogEntry entry = newEntry();
        entry.setMessage(message);
        entry.setCause(cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : null);
        addEntry(entry);
    }

    private ErrorLogEntry newEntry() {
        ErrorLogEntry entry = new ErrorLogEntry();
        entry.setTimestamp(System.currentTimeMillis());
        entry.setRecordedAt(LocalDateTime.now());
        return entry;
    }

    private void addEntry(ErrorLogEntry entry) {
        if (errorBuffer.size() >= DEFAULT_CAPACITY) {
            errorBuffer.removeFirst();
        }
        errorBuffer.addLast(entry);
    }

    /**
     * 查询指定时间 (毫秒时间戳) 之后的错误日志
     */
    public synchronized List<ErrorLogEntry> listSince(long sinceMillis) {
        List<ErrorLogEntry> result = new ArrayList<>();
        for (ErrorLogEntry entry : errorBuffer) {
            if (entry.getTimestamp() >= sinceMillis) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * 查询所有错误日志
     */
    public synchronized List<ErrorLogEntry> listAll() {
        return new ArrayList<>(errorBuffer);
    }

    public synchronized void clear() {
        errorBuffer.clear();
    }

    /**
     * 错误日志条目
     */
    @Data
    public static class ErrorLogEntry {
        private RouteErrorTypeEnum errorType; // 未预期异常时为空
        private String message;
        private String cause;
        private String startLocation;
        private Integer missionCount;
        private List<String> remainingMissions;
        private long timestamp;
        private LocalDateTime recordedAt;
    }
}
