package com.example.cpt.service.epub;

import com.example.cpt.dto.PageLocation;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * 页码 → 位置索引。页码可以不连续，每个页码只对应一个位置。
 */
public class PageIndex {

    private final NavigableMap<Integer, PageLocation> pages;

    public PageIndex(Map<Integer, PageLocation> pages) {
        this.pages = Collections.unmodifiableNavigableMap(new TreeMap<>(pages));
    }

    public PageLocation get(int pageNumber) {
        return pages.get(pageNumber);
    }

    public boolean contains(int pageNumber) {
        return pages.containsKey(pageNumber);
    }

    public Set<Integer> pageNumbers() {
        return pages.keySet();
    }

    public int size() {
        return pages.size();
    }

    public boolean isEmpty() {
        return pages.isEmpty();
    }

    public NavigableMap<Integer, PageLocation> asMap() {
        return pages;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PageIndex)) {
            return false;
        }
        return pages.equals(((PageIndex) o).pages);
    }

    @Override
    public int hashCode() {
        return pages.hashCode();
    }

    @Override
    public String toString() {
        return "PageIndex{pages=" + pages.size() + "}";
    }
}
