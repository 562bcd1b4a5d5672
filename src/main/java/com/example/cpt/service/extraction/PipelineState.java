package com.example.cpt.service.extraction;

import com.example.cpt.dto.CodeRecord;
import com.example.cpt.dto.HierarchyContext;
import lombok.Getter;

/**
 * 跨chunk传递的运行状态
 * <p>
 * lastRecord 只在某个chunk成功解析出记录后才更新；解析失败的chunk不会清空它，
 * 下一个chunk仍使用上一次成功的记录作为父编码上下文。
 */
@Getter
public class PipelineState {

    private HierarchyContext hierarchy = HierarchyContext.unresolved();
    private CodeRecord lastRecord;
    private int processedChunks;
    private int failedChunks;
    private int totalRecords;

    void updateHierarchy(HierarchyContext hierarchy) {
        this.hierarchy = hierarchy != null ? hierarchy : HierarchyContext.unresolved();
    }

    void recordSuccess(CodeRecord lastRecord, int recordCount) {
        this.lastRecord = lastRecord;
        this.processedChunks++;
        this.totalRecords += recordCount;
    }

    void recordFailure() {
        this.processedChunks++;
        this.failedChunks++;
    }
}
