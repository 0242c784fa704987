package com.clipsmaster.fuse.core;

import com.clipsmaster.fuse.model.EventQuery;
import com.clipsmaster.fuse.model.FuseEvent;
import com.clipsmaster.fuse.model.TimeRange;

import java.util.List;

/**
 * 审计事件存储接口。
 */
public interface EventStorage {

    /**
     * 保存事件。
     *
     * @return 事件ID
     */
    String store(FuseEvent event);

    /** 不存在时返回null */
    FuseEvent get(String eventId);

    /**
     * 按条件查询事件，按时间倒序（最新在前）。
     *
     * @param timeRange 为null时不限时间
     */
    List<FuseEvent> query(EventQuery query, TimeRange timeRange, int limit);

    /**
     * 返回related_ids中引用了指定事件的全部事件，按时间正序。
     */
    List<FuseEvent> findReferencing(String eventId);

    int size();

    void close();
}
