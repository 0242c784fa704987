package com.clipsmaster.fuse.storage;

import com.clipsmaster.fuse.model.EventQuery;
import com.clipsmaster.fuse.model.FuseEvent;
import com.clipsmaster.fuse.model.TimeRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 各存储实现共用的过滤与排序逻辑。
 */
final class EventFilters {

    private EventFilters() {}

    /**
     * 过滤后按时间倒序返回，同一时间戳的后写入者在前。
     *
     * @param candidates 按写入顺序排列的候选事件
     */
    static List<FuseEvent> newestFirst(List<FuseEvent> candidates, EventQuery query,
                                       TimeRange timeRange, int limit) {
        List<FuseEvent> matched = new ArrayList<>();
        for (FuseEvent event : candidates) {
            if (event == null) continue;
            if (timeRange != null && !timeRange.contains(event.getTimestamp())) continue;
            if (query != null && !query.matches(event)) continue;
            matched.add(event);
        }
        Collections.reverse(matched);
        matched.sort(Comparator.comparingLong(FuseEvent::getTimestamp).reversed());
        if (limit > 0 && matched.size() > limit) {
            return new ArrayList<>(matched.subList(0, limit));
        }
        return matched;
    }
}
