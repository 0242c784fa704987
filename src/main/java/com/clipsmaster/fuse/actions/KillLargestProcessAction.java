package com.clipsmaster.fuse.actions;

import com.clipsmaster.fuse.core.ActionContext;
import com.clipsmaster.fuse.core.ActionHandler;
import com.clipsmaster.fuse.core.MemoryProbe;
import com.clipsmaster.fuse.model.FuseLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * 终止占用内存最多的子进程。仅在 EMERGENCY 级别执行。
 *
 * 候选范围是本进程的全部后代进程；进程内存取自 /proc/&lt;pid&gt;/status 的 VmRSS，
 * 在无 /proc 的平台上没有可比较的候选，动作返回false。
 *
 * 参数：
 * - exclude_processes: 名称中包含这些关键字的进程不参与 (LIST, 默认 clipsmaster_core,system)
 * - max_memory_percent: 最大进程占物理内存比例低于此值时不执行 (NUMBER, 默认 20)
 */
public class KillLargestProcessAction implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(KillLargestProcessAction.class);

    static final List<String> DEFAULT_EXCLUDES = List.of("clipsmaster_core", "system");
    private static final long TERMINATE_WAIT_SECONDS = 3L;

    private final MemoryProbe probe;

    public KillLargestProcessAction(MemoryProbe probe) {
        this.probe = probe;
    }

    @Override
    public boolean execute(ActionContext context) throws Exception {
        if (context.getLevel() != FuseLevel.EMERGENCY) {
            log.warn("kill_largest_process is only allowed at EMERGENCY, current level: {}", context.getLevel());
            return false;
        }
        List<String> excludes = context.getListParameter("exclude_processes", DEFAULT_EXCLUDES);
        double maxMemoryPercent = context.getParameter("max_memory_percent", 20.0);

        ProcessHandle largest = null;
        long largestRssKb = 0;
        for (ProcessHandle process : (Iterable<ProcessHandle>) ProcessHandle.current().descendants()::iterator) {
            String name = processName(process).toLowerCase(Locale.ROOT);
            if (excludes.stream().anyMatch(ex -> name.contains(ex.toLowerCase(Locale.ROOT)))) {
                continue;
            }
            OptionalLong rss = residentKb(process.pid());
            if (rss.isPresent() && rss.getAsLong() > largestRssKb) {
                largest = process;
                largestRssKb = rss.getAsLong();
            }
        }

        if (largest == null) {
            log.info("No killable child process found");
            return false;
        }

        double totalMb = probe.getTotalMb();
        double percent = totalMb > 0 ? (largestRssKb / 1024.0) / totalMb * 100.0 : 0.0;
        if (percent < maxMemoryPercent) {
            log.info("Largest child process {} uses {}% of memory, below the {}% limit, not killing",
                    largest.pid(), String.format("%.1f", percent), maxMemoryPercent);
            return false;
        }

        log.warn("Killing largest child process: pid={}, name={}, memory={}%",
                largest.pid(), processName(largest), String.format("%.1f", percent));
        largest.destroy();
        try {
            largest.onExit().get(TERMINATE_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (java.util.concurrent.TimeoutException e) {
            log.warn("Process {} did not exit within {}s, forcing", largest.pid(), TERMINATE_WAIT_SECONDS);
            largest.destroyForcibly();
        }
        return true;
    }

    private static String processName(ProcessHandle process) {
        Optional<String> command = process.info().command();
        return command.map(c -> Paths.get(c).getFileName().toString()).orElse(String.valueOf(process.pid()));
    }

    /** 读取 /proc/&lt;pid&gt;/status 中的 VmRSS（kB） */
    static OptionalLong residentKb(long pid) {
        Path status = Paths.get("/proc", String.valueOf(pid), "status");
        if (!Files.isReadable(status)) {
            return OptionalLong.empty();
        }
        try {
            for (String line : Files.readAllLines(status, StandardCharsets.UTF_8)) {
                if (line.startsWith("VmRSS:")) {
                    String[] parts = line.substring(6).trim().split("\\s+");
                    return OptionalLong.of(Long.parseLong(parts[0]));
                }
            }
        } catch (IOException | NumberFormatException e) {
            log.debug("Cannot read memory of process {}: {}", pid, e.getMessage());
        }
        return OptionalLong.empty();
    }
}
