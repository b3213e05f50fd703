package uk.gegc.lessondocs.features.document.application.layout;

/**
 * Cursor and page bookkeeping for one render call. Never shared between renders.
 */
public final class PageState {

    private int currentPageIndex = 1;
    private Integer totalPages;
    private float cursorY;

    PageState(float cursorY) {
        this.cursorY = cursorY;
    }

    public int currentPageIndex() {
        return currentPageIndex;
    }

    public Integer totalPages() {
        return totalPages;
    }

    public float cursorY() {
        return cursorY;
    }

    void moveTo(float y) {
        this.cursorY = y;
    }

    void advance(float dy) {
        this.cursorY += dy;
    }

    void nextPage(float topY) {
        currentPageIndex++;
        cursorY = topY;
    }

    void finalizeTotal(int total) {
        if (totalPages != null) {
            throw new IllegalStateException("Total page count already finalized as " + totalPages);
        }
        if (total < currentPageIndex) {
            throw new IllegalStateException("Total page count " + total + " is below current page " + currentPageIndex);
        }
        this.totalPages = total;
    }
}
