package com.example.cpt.service.epub;

import com.example.cpt.dto.ChapterBoundary;
import com.example.cpt.dto.PageLocation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 按spine文件划分章节页码范围：每个至少拥有一个页码的文件对应一个范围，按spine顺序输出
 */
public class ChapterBoundaryDetector {

    private final List<String> spine;
    private final PageIndex pageIndex;

    public ChapterBoundaryDetector(List<String> spine, PageIndex pageIndex) {
        this.spine = spine;
        this.pageIndex = pageIndex;
    }

    public List<ChapterBoundary> boundaries() {
        Map<String, int[]> minMaxByFile = new HashMap<>();
        for (Map.Entry<Integer, PageLocation> entry : pageIndex.asMap().entrySet()) {
            int page = entry.getKey();
            minMaxByFile.merge(entry.getValue().getFileId(), new int[]{page, page},
                    (a, b) -> new int[]{Math.min(a[0], b[0]), Math.max(a[1], b[1])});
        }

        List<ChapterBoundary> boundaries = new ArrayList<>();
        for (String fileId : spine) {
            // 同一id在spine中重复出现时只输出一次
            int[] range = minMaxByFile.remove(fileId);
            if (range != null) {
                boundaries.add(new ChapterBoundary(fileId, range[0], range[1]));
            }
        }
        return boundaries;
    }
}
