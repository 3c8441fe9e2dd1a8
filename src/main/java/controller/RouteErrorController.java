package controller;

import common.Result;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.route.impl.RouteErrorLog;

import java.util.List;

/**
 * 路线规划错误日志查询接口
 */
@RestController
@RequestMapping("/api/errors")
public class RouteErrorController {

    private final RouteErrorLog errorLog;

    public RouteErrorController(RouteErrorLog errorLog) {
        this.errorLog = errorLog;
    }

    /**
     * 查询指定时间 (毫秒时间戳) 之后的错误日志
     */
    @GetMapping
    public Result listErrors(@RequestParam(name = "since", defaultValue = "0") long sinceMillis) {
        List<RouteErrorLog.ErrorLogEntry> entries = errorLog.listSince(sinceMillis);
        return Result.success(entries);
    }

    /**
     * 查询所有错误日志
     */
    @GetMapping("/all")
    public Result listAllErrors() {
        return Result.success(errorLog.listAll());
    }
}
