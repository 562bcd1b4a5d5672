package com.example.cpt.service.extraction;

import com.example.cpt.dto.ChapterBoundary;
import com.example.cpt.dto.ExtractionChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 将请求的页码区间切分为按页码递增的chunk列表
 */
@Slf4j
@Component
public class ChunkPlanner {

    /**
     * 固定页数切分，最后一段截止到 endPage
     */
    public List<ExtractionChunk> planFixed(int startPage, int endPage, int chunkSize) {
        validateRange(startPage, endPage);
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize 必须大于0: " + chunkSize);
        }

        List<ExtractionChunk> chunks = new ArrayList<>();
        // long 游标，endPage 接近 Integer.MAX_VALUE 时不溢出
        for (long current = startPage; current <= endPage; current += chunkSize) {
            int chunkEnd = (int) Math.min(current + chunkSize - 1, endPage);
            chunks.add(new ExtractionChunk((int) current, chunkEnd));
        }
        return chunks;
    }

    /**
     * 按章节切分：取与请求区间有交集的所有章节，使用章节自身的完整范围（不裁剪）
     */
    public List<ExtractionChunk> planByChapter(List<ChapterBoundary> boundaries, int startPage, int endPage) {
        validateRange(startPage, endPage);

        List<ExtractionChunk> chunks = new ArrayList<>();
        for (ChapterBoundary boundary : boundaries) {
            if (boundary.overlaps(startPage, endPage)) {
                chunks.add(new ExtractionChunk(boundary.getStartPage(), boundary.getEndPage()));
            }
        }
        log.info("找到 {} 个与页 {}-{} 重叠的章节", chunks.size(), startPage, endPage);
        return chunks;
    }

    private void validateRange(int startPage, int endPage) {
        if (startPage > endPage) {
            throw new IllegalArgumentException("起始页不能大于结束页: " + startPage + " > " + endPage);
        }
    }
}
