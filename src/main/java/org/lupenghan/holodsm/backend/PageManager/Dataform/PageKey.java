package org.lupenghan.holodsm.backend.PageManager.Dataform;

import lombok.Getter;

/**
 * 页面标识符，由数组ID和数组内的页号共同确定
 */
@Getter
public class PageKey {

    private final String arrayId;   // 所属数组ID

    private final int pageId;       // 数组内的页号

    public PageKey(String arrayId, int pageId) {
        this.arrayId = arrayId;
        this.pageId = pageId;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        PageKey other = (PageKey) obj;
        return pageId == other.pageId && arrayId.equals(other.arrayId);
    }

    @Override
    public int hashCode() {
        return 31 * arrayId.hashCode() + pageId;
    }

    @Override
    public String toString() {
        return "PageKey{arrayId=" + arrayId + ", pageId=" + pageId + "}";
    }
}
