package com.github.yoep.paging.core;

import com.github.yoep.paging.core.environment.PlatformProvider;
import com.github.yoep.paging.core.model.FooterEntry;
import com.github.yoep.paging.core.model.FooterMarker;
import com.github.yoep.paging.core.model.ListEntry;
import com.github.yoep.paging.core.model.LoadingState;
import com.github.yoep.paging.core.model.PageRequest;
import com.github.yoep.paging.core.view.PagingView;
import com.github.yoep.paging.core.view.Placeholder;
import com.github.yoep.paging.core.view.ScrollListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PagingControllerTest {
    @Mock
    private PagingView<String> view;
    @Mock
    private Placeholder placeholder;

    private final List<PageRequest> requests = new ArrayList<>();
    private final Queue<CompletableFuture<List<String>>> pages = new LinkedList<>();

    @Test
    void testAttachTo_whenEagerStartIsEnabled_shouldLoadTheFirstPage() {
        var controller = createController(true, 0, 10);
        pages.add(page(1, 10));

        controller.attachTo(view);

        assertEquals(List.of(new PageRequest(0, 10)), requests);
        assertEquals(items(1, 10), controller.getItems());
        assertEquals(LoadingState.DONE, controller.getLoadingState());
        verify(view).addScrollListener(isA(ScrollListener.class));
        verify(view).onAttached(controller);
        assertInvariants(controller);
    }

    @Test
    void testAttachTo_whenEagerStartIsDisabled_shouldNotLoadAnyPage() {
        var controller = createController(false, 0, 10);

        controller.attachTo(view);

        assertTrue(requests.isEmpty(), "expected no page to have been requested");
        assertEquals(0, controller.getItemCount());
    }

    @Test
    void testAttachTo_whenFirstPageIsLoaded_shouldNotifyTheMinimalMutations() {
        var controller = createController(true, 0, 10);
        pages.add(page(1, 10));

        controller.attachTo(view);

        var inOrder = inOrder(view);
        inOrder.verify(view).notifyInserted(0);
        inOrder.verify(view).notifyRangeInserted(0, 10);
        inOrder.verify(view).notifyRemoved(10);
        verify(view, never()).notifyChanged(anyInt());
    }

    @Test
    void testAttachTo_whenControllerIsDisposed_shouldThrowIllegalStateException() {
        var controller = createController(true, 0, 10);

        controller.close();

        assertThrows(IllegalStateException.class, () -> controller.attachTo(view));
    }

    @Test
    void testOnScrollPositionChanged_whenPagesAreExhausted_shouldStopRequestingPages() {
        var controller = createController(true, 0, 10);
        var loader = controller.getPageLoader().orElseThrow();
        pages.add(page(1, 10));
        pages.add(page(11, 5));
        controller.attachTo(view);

        assertEquals(items(1, 10), controller.getItems());
        assertFalse(loader.isReachedEnd(), "expected the end not to have been reached");

        controller.onScrollPositionChanged(9);
        assertEquals(items(1, 15), controller.getItems());
        assertEquals(LoadingState.DONE, controller.getLoadingState());
        assertTrue(loader.isReachedEnd(), "expected the end to have been reached");
        assertEquals(new PageRequest(10, 10), requests.get(1));

        controller.onScrollPositionChanged(14);
        assertEquals(2, requests.size());
        assertEquals(items(1, 15), controller.getItems());
        assertEquals(LoadingState.DONE, controller.getLoadingState());
        assertInvariants(controller);
    }

    @Test
    void testOnScrollPositionChanged_whenPageIsSmallerThanPageSize_shouldTransitionDirectlyToDone() {
        var controller = createController(false, 0, 20);
        pages.add(page(1, 7));
        controller.attachTo(view);

        controller.onScrollPositionChanged(-1);
        assertTrue(controller.getPageLoader().orElseThrow().isReachedEnd());
        clearInvocations(view);

        controller.onScrollPositionChanged(6);

        assertEquals(1, requests.size());
        assertEquals(LoadingState.DONE, controller.getLoadingState());
        verify(view, never()).notifyInserted(anyInt());
        assertInvariants(controller);
    }

    @Test
    void testOnScrollPositionChanged_whenLastEntryIsNotVisible_shouldNotRequestPage() {
        var controller = createController(true, 0, 10);
        pages.add(page(1, 10));
        controller.attachTo(view);

        controller.onScrollPositionChanged(5);

        assertEquals(1, requests.size());
    }

    @Test
    void testOnScrollPositionChanged_whenPageIsBeingLoaded_shouldIgnoreTheScroll() {
        var controller = createController(true, 0, 10);
        pages.add(new CompletableFuture<>());
        controller.attachTo(view);

        controller.onScrollPositionChanged(0);

        assertEquals(1, requests.size());
        assertEquals(LoadingState.LOADING, controller.getLoadingState());
        assertInvariants(controller);
    }

    @Test
    void testOnScrollPositionChanged_whenNoPageLoaderIsBound_shouldForceDone() {
        var controller = new PagingController<String>(Runnable::run);
        controller.attachTo(view);
        controller.addItem("A");
        clearInvocations(view);

        controller.onScrollPositionChanged(0);

        assertEquals(LoadingState.DONE, controller.getLoadingState());
        assertFalse(controller.hasFooter());
        verifyNoInteractions(view);
    }

    @Test
    void testOnScrollPositionChanged_whenPageFailedToLoad_shouldShowErrorInTheLoadingSlot() {
        var controller = createController(true, 0, 10);
        pages.add(page(1, 10));
        pages.add(CompletableFuture.failedFuture(new RuntimeException("connection refused")));
        controller.attachTo(view);
        clearInvocations(view);

        controller.onScrollPositionChanged(9);

        assertEquals(11, controller.getItemCount());
        assertEquals(Optional.of(new FooterEntry<String>(FooterMarker.ERROR)), controller.getItem(10));
        assertEquals(LoadingState.ERROR, controller.getLoadingState());
        verify(view).notifyInserted(10);
        verify(view).notifyChanged(10);
        verify(view, never()).notifyRemoved(anyInt());
        assertTrue(controller.getPageLoader().orElseThrow().getLastError().isPresent());
        assertInvariants(controller);
    }

    @Test
    void testOnScrollPositionChanged_whenErrorIsShown_shouldRetryTheFailedPage() {
        var controller = createController(true, 0, 10);
        pages.add(CompletableFuture.failedFuture(new RuntimeException("timeout")));
        pages.add(page(1, 10));
        controller.attachTo(view);
        assertEquals(LoadingState.ERROR, controller.getLoadingState());

        controller.onScrollPositionChanged(0);

        assertEquals(List.of(new PageRequest(0, 10), new PageRequest(0, 10)), requests);
        assertEquals(items(1, 10), controller.getItems());
        assertEquals(LoadingState.DONE, controller.getLoadingState());
        assertInvariants(controller);
    }

    @Test
    void testAddItem_whenItemIsNotPresent_shouldAppendAndNotify() {
        var controller = createAttachedControllerWithoutLoader();

        var result = controller.addItem("A");

        assertTrue(result);
        assertEquals(List.of("A"), controller.getItems());
        verify(view).notifyInserted(0);
    }

    @Test
    void testAddItem_whenItemIsAlreadyPresent_shouldIgnoreTheItem() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItem("A");
        clearInvocations(view);

        var result = controller.addItem("A");

        assertFalse(result);
        assertEquals(1, controller.getItemCount());
        verifyNoInteractions(view);
    }

    @Test
    void testAddItems_whenBatchOverlapsWithExistingItems_shouldOnlyAppendAndNotifyNewItems() {
        var controller = createAttachedControllerWithoutLoader();

        controller.addItems(List.of("A", "B"));
        var result = controller.addItems(List.of("B", "C"));

        assertEquals(1, result);
        assertEquals(List.of("A", "B", "C"), controller.getItems());
        verify(view).notifyRangeInserted(0, 2);
        verify(view).notifyRangeInserted(2, 1);
        verifyNoMoreInteractions(view);
    }

    @Test
    void testAddItems_whenBatchIsFullyPresent_shouldNotMutateTheList() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItems(List.of("A", "B", "C"));
        clearInvocations(view);

        var result = controller.addItems(List.of("C", "A"));

        assertEquals(0, result);
        assertEquals(List.of("A", "B", "C"), controller.getItems());
        verifyNoInteractions(view);
    }

    @Test
    void testAddItems_whenBatchContainsDuplicates_shouldAddEachItemOnce() {
        var controller = createAttachedControllerWithoutLoader();

        controller.addItems(List.of("A", "B", "A"));

        assertEquals(List.of("A", "B"), controller.getItems());
        verify(view).notifyRangeInserted(0, 2);
    }

    @Test
    void testAddItems_whenFooterIsPresent_shouldInsertBeforeTheFooter() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItem("A");
        controller.onLoadingStateChanged(LoadingState.LOADING);
        clearInvocations(view);

        controller.addItems(List.of("B", "C"));

        assertEquals(4, controller.getItemCount());
        assertEquals(List.of("A", "B", "C"), controller.getItems());
        assertTrue(controller.getItem(3).orElseThrow().isFooter());
        verify(view).notifyRangeInserted(1, 2);
        assertInvariants(controller);
    }

    @Test
    void testInsertItem_whenPositionIsValid_shouldInsertAtPosition() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItems(List.of("A", "C"));

        var result = controller.insertItem("B", 1);

        assertTrue(result);
        assertEquals(List.of("A", "B", "C"), controller.getItems());
        verify(view).notifyInserted(1);
    }

    @Test
    void testInsertItem_whenItemIsAlreadyPresent_shouldRejectTheItem() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItems(List.of("A", "B"));
        clearInvocations(view);

        var result = controller.insertItem("B", 0);

        assertFalse(result);
        assertEquals(List.of("A", "B"), controller.getItems());
        verifyNoInteractions(view);
    }

    @Test
    void testInsertItem_whenPositionIsOutOfRange_shouldRejectTheItem() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItem("A");

        assertFalse(controller.insertItem("B", 5));
        assertFalse(controller.insertItem("B", -1));
        assertEquals(List.of("A"), controller.getItems());
    }

    @Test
    void testInsertItem_whenPositionIsTheFooterSlot_shouldKeepTheFooterLast() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItem("A");
        controller.onLoadingStateChanged(LoadingState.LOADING);

        var result = controller.insertItem("B", 1);

        assertTrue(result);
        assertEquals(List.of("A", "B"), controller.getItems());
        assertTrue(controller.getItem(2).orElseThrow().isFooter());
    }

    @Test
    void testRemoveItemAt_whenPageIsBeingLoaded_shouldRejectTheRemoval() {
        var controller = createController(true, 0, 10);
        pages.add(new CompletableFuture<>());
        controller.attachTo(view);
        controller.addItems(List.of("A", "B"));
        clearInvocations(view);

        var result = controller.removeItemAt(0);

        assertFalse(result);
        assertEquals(List.of("A", "B"), controller.getItems());
        verify(view, never()).notifyRemoved(anyInt());
    }

    @Test
    void testRemoveItemAt_whenLoadingIsDone_shouldRemoveTheItem() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItems(List.of("A", "B", "C"));

        var result = controller.removeItemAt(1);

        assertTrue(result);
        assertEquals(List.of("A", "C"), controller.getItems());
        verify(view).notifyRemoved(1);
    }

    @Test
    void testRemoveItemAt_whenItemHasBeenRemoved_shouldAllowTheItemToBeAddedAgain() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItems(List.of("A", "B"));
        controller.removeItemAt(0);

        var result = controller.addItem("A");

        assertTrue(result);
        assertEquals(List.of("B", "A"), controller.getItems());
    }

    @Test
    void testRemoveItemAt_whenPositionIsOutOfRange_shouldIgnoreTheRemoval() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItem("A");

        assertFalse(controller.removeItemAt(1));
        assertFalse(controller.removeItemAt(-1));
        verify(view, never()).notifyRemoved(anyInt());
    }

    @Test
    void testRemoveItemAt_whenListBecomesEmpty_shouldShowThePlaceholder() {
        var controller = createController(false, 0, 10);
        controller.attachTo(view);
        controller.addItem("A");

        controller.removeItemAt(0);

        assertEquals(0, controller.getItemCount());
        verify(placeholder).showPlaceholder();
    }

    @Test
    void testAddItem_whenListWasEmpty_shouldHideThePlaceholder() {
        var controller = createController(false, 0, 10);
        controller.attachTo(view);

        controller.addItem("A");
        controller.addItem("B");

        verify(placeholder, times(1)).hidePlaceholder();
    }

    @Test
    void testOnLoadingStateChanged_whenFirstPageIsEmpty_shouldShowThePlaceholder() {
        var controller = createController(true, 0, 10);
        pages.add(CompletableFuture.completedFuture(List.of()));

        controller.attachTo(view);

        assertEquals(0, controller.getItemCount());
        assertTrue(controller.getPageLoader().orElseThrow().isReachedEnd());
        verify(placeholder).showPlaceholder();
    }

    @Test
    void testGetItem_whenPositionIsOutOfRange_shouldReturnEmpty() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItem("A");

        assertEquals(Optional.of(ListEntry.item("A")), controller.getItem(0));
        assertEquals(Optional.empty(), controller.getItem(1));
        assertEquals(Optional.empty(), controller.getItem(-1));
    }

    @Test
    void testClearAndReload_shouldResetTheListAndRequestTheFirstPageAgain() {
        var controller = createController(true, 5, 10);
        var loader = controller.getPageLoader().orElseThrow();
        pages.add(page(1, 3));
        pages.add(new CompletableFuture<>());
        controller.attachTo(view);
        assertTrue(loader.isReachedEnd());
        clearInvocations(view);

        controller.clearAndReload();

        verify(view).notifyReset();
        assertTrue(controller.getItems().isEmpty(), "expected all items to have been removed");
        assertFalse(loader.isReachedEnd());
        assertEquals(5, loader.getCurrentPosition());
        assertEquals(List.of(new PageRequest(5, 10), new PageRequest(5, 10)), requests);
        assertInvariants(controller);
    }

    @Test
    void testClearAndReload_whenPreviousPageCompletesAfterReload_shouldDiscardThePreviousPage() {
        var controller = createController(true, 0, 10);
        var previousPage = new CompletableFuture<List<String>>();
        pages.add(previousPage);
        pages.add(page(100, 10));
        controller.attachTo(view);

        controller.clearAndReload();
        previousPage.complete(items(1, 10));

        assertEquals(items(100, 109), controller.getItems());
        assertEquals(LoadingState.DONE, controller.getLoadingState());
        assertInvariants(controller);
    }

    @Test
    void testOnLoadingStateChanged_whenSameStateIsAppliedTwice_shouldReplaceTheFooterInPlace() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItem("A");
        clearInvocations(view);

        controller.onLoadingStateChanged(LoadingState.LOADING);
        controller.onLoadingStateChanged(LoadingState.LOADING);

        assertEquals(2, controller.getItemCount());
        assertEquals(1, footerCount(controller));
        verify(view).notifyInserted(1);
        verify(view).notifyChanged(1);
        verifyNoMoreInteractions(view);
        assertInvariants(controller);
    }

    @Test
    void testOnLoadingStateChanged_whenDoneIsAppliedTwice_shouldRemoveTheFooterOnce() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItem("A");
        controller.onLoadingStateChanged(LoadingState.LOADING);
        clearInvocations(view);

        controller.onLoadingStateChanged(LoadingState.DONE);
        controller.onLoadingStateChanged(LoadingState.DONE);

        assertEquals(List.of("A"), controller.getItems());
        assertEquals(1, controller.getItemCount());
        verify(view).notifyRemoved(1);
        verifyNoMoreInteractions(view);
    }

    @Test
    void testOnLoadingStateChanged_whenErrorArrivesWithoutFooter_shouldAppendTheErrorFooter() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItem("A");

        controller.onLoadingStateChanged(LoadingState.ERROR);

        assertEquals(Optional.of(new FooterEntry<String>(FooterMarker.ERROR)), controller.getItem(1));
        assertInvariants(controller);
    }

    @Test
    void testOnLoadingStateChanged_whenDoneArrivesBeforeItems_shouldAppendItemsAfterwards() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItem("A");

        controller.onLoadingStateChanged(LoadingState.LOADING);
        controller.onLoadingStateChanged(LoadingState.DONE);
        controller.onItemsLoaded(List.of("B", "C"));

        assertEquals(List.of("A", "B", "C"), controller.getItems());
        assertEquals(3, controller.getItemCount());
        assertInvariants(controller);
    }

    @Test
    void testOnLoadingStateChanged_whenItemsArriveBeforeDone_shouldKeepTheFooterLast() {
        var controller = createAttachedControllerWithoutLoader();
        controller.addItem("A");

        controller.onLoadingStateChanged(LoadingState.LOADING);
        controller.onItemsLoaded(List.of("B", "C"));
        assertTrue(controller.getItem(3).orElseThrow().isFooter());
        assertInvariants(controller);

        controller.onLoadingStateChanged(LoadingState.DONE);
        assertEquals(List.of("A", "B", "C"), controller.getItems());
        assertEquals(3, controller.getItemCount());
        assertInvariants(controller);
    }

    @Test
    void testSetPageLoader_whenLoaderIsUnbound_shouldNoLongerRequestPages() {
        var controller = createController(true, 0, 10);
        var loader = controller.getPageLoader().orElseThrow();
        pages.add(page(1, 10));
        controller.attachTo(view);

        controller.setPageLoader(null);
        controller.onScrollPositionChanged(9);
        loader.fetchNextPage();

        assertEquals(1, requests.size());
        assertEquals(LoadingState.DONE, controller.getLoadingState());
        assertTrue(controller.getPageLoader().isEmpty());
    }

    @Test
    void testClose_whenPageCompletesAfterDisposal_shouldDropTheEmissions() {
        var controller = createController(true, 0, 10);
        var pendingPage = new CompletableFuture<List<String>>();
        pages.add(pendingPage);
        controller.attachTo(view);

        controller.close();
        pendingPage.complete(items(1, 10));

        assertTrue(controller.isDisposed());
        assertTrue(controller.getItems().isEmpty(), "expected the page to have been dropped");
        verify(view).removeScrollListener(isA(ScrollListener.class));
        verify(view).onDetached();
    }

    @Test
    void testDetach_whenPageCompletesWhileDetached_shouldDropTheEmissions() {
        var controller = createController(true, 0, 10);
        var pendingPage = new CompletableFuture<List<String>>();
        pages.add(pendingPage);
        controller.attachTo(view);

        controller.detach();
        pendingPage.complete(items(1, 10));

        assertTrue(controller.getItems().isEmpty(), "expected the page to have been dropped");
        verify(view).onDetached();
    }

    @Test
    void testAttachTo_whenReattached_shouldReceiveEmissionsAgain() {
        var controller = createController(false, 0, 10);
        pages.add(page(1, 10));
        controller.attachTo(view);
        controller.detach();

        controller.attachTo(view);
        controller.onScrollPositionChanged(-1);

        assertEquals(items(1, 10), controller.getItems());
    }

    @Test
    void testClearAndReload_whenPreviousEmissionsAreStillQueued_shouldStartFromAnEmptyList() {
        var rendererQueue = new LinkedList<Runnable>();
        var controller = createController(true, 0, 10, rendererQueue::add);
        var reloadedPage = new CompletableFuture<List<String>>();
        pages.add(page(1, 10));
        pages.add(reloadedPage);
        controller.attachTo(view);

        controller.clearAndReload();
        assertEquals(0, controller.getItemCount(), "expected the list to be empty after the reload");

        runRenderer(rendererQueue);
        assertTrue(controller.getItems().isEmpty(), "expected the queued page of before the reload to have been discarded");
        assertEquals(List.of(ListEntry.footer(FooterMarker.LOADING)), controller.getEntries());

        reloadedPage.complete(items(100, 109));
        runRenderer(rendererQueue);
        assertEquals(items(100, 109), controller.getItems());
        assertEquals(LoadingState.DONE, controller.getLoadingState());
        assertInvariants(controller);
    }

    @Test
    void testAttachTo_whenPageCompletedWhileDetached_shouldSettleTheLoadingState() {
        var controller = createController(false, 0, 10);
        var pendingPage = new CompletableFuture<List<String>>();
        pages.add(pendingPage);
        pages.add(page(11, 10));
        controller.attachTo(view);
        controller.onScrollPositionChanged(-1);
        controller.detach();
        pendingPage.complete(items(1, 10));

        controller.attachTo(view);
        assertEquals(LoadingState.DONE, controller.getLoadingState());
        assertInvariants(controller);

        controller.onScrollPositionChanged(-1);
        assertEquals(List.of(new PageRequest(0, 10), new PageRequest(10, 10)), requests);
        assertEquals(items(11, 20), controller.getItems());
        assertInvariants(controller);
    }

    @Test
    void testAttachTo_whenPageFailedWhileDetached_shouldSettleToError() {
        var controller = createController(false, 0, 10);
        var pendingPage = new CompletableFuture<List<String>>();
        pages.add(pendingPage);
        controller.attachTo(view);
        controller.onScrollPositionChanged(-1);
        controller.detach();
        pendingPage.completeExceptionally(new IllegalStateException("offline"));

        controller.attachTo(view);

        assertEquals(LoadingState.ERROR, controller.getLoadingState());
        assertEquals(Optional.of(new FooterEntry<String>(FooterMarker.ERROR)), controller.getItem(0));
        assertInvariants(controller);
    }

    @Test
    void testOnScrollPositionChanged_whenPageContainsNullItem_shouldShowErrorAndAllowRetry() {
        var controller = createController(true, 0, 10);
        pages.add(CompletableFuture.completedFuture(Arrays.asList("i1", null)));
        pages.add(page(1, 10));
        controller.attachTo(view);
        assertEquals(LoadingState.ERROR, controller.getLoadingState());
        assertInvariants(controller);

        controller.onScrollPositionChanged(0);

        assertEquals(items(1, 10), controller.getItems());
        assertEquals(LoadingState.DONE, controller.getLoadingState());
        assertInvariants(controller);
    }

    @Test
    void testAddItems_whenBatchContainsNull_shouldLeaveTheListUntouched() {
        var controller = createAttachedControllerWithoutLoader();

        assertThrows(NullPointerException.class, () -> controller.addItems(Arrays.asList("A", null)));

        assertTrue(controller.getItems().isEmpty());
        verifyNoInteractions(view);
        assertTrue(controller.addItem("A"), "expected the item of the rejected batch to be accepted");
        assertEquals(List.of("A"), controller.getItems());
    }

    @Test
    void testSetPageLoader_whenReplacedLoaderCompletesLater_shouldDiscardItsPage() {
        var controller = createController(true, 0, 10);
        var pendingPage = new CompletableFuture<List<String>>();
        pages.add(pendingPage);
        controller.attachTo(view);
        var replacement = new PageLoader<String>(request -> page(50, 10), 0, 10);

        controller.setPageLoader(replacement);
        pendingPage.complete(items(1, 10));
        assertTrue(controller.getItems().isEmpty(), "expected the page of the replaced loader to have been discarded");

        controller.onScrollPositionChanged(0);
        assertEquals(items(50, 59), controller.getItems());
        assertEquals(LoadingState.DONE, controller.getLoadingState());
        assertInvariants(controller);
    }

    private PagingController<String> createController(boolean eagerStart, int offset, int pageSize) {
        return createController(eagerStart, offset, pageSize, Runnable::run);
    }

    private PagingController<String> createController(boolean eagerStart, int offset, int pageSize, PlatformProvider platformProvider) {
        var loader = new PageLoader<String>(request -> {
            requests.add(request);
            return pages.poll();
        });
        loader.configure(offset, pageSize, placeholder);

        var controller = new PagingController<String>(platformProvider, eagerStart);
        controller.setPageLoader(loader);
        return controller;
    }

    private static void runRenderer(Queue<Runnable> rendererQueue) {
        Runnable runnable;
        while ((runnable = rendererQueue.poll()) != null) {
            runnable.run();
        }
    }

    private PagingController<String> createAttachedControllerWithoutLoader() {
        var controller = new PagingController<String>(Runnable::run, false);
        controller.attachTo(view);
        clearInvocations(view);
        return controller;
    }

    private static CompletableFuture<List<String>> page(int first, int size) {
        return CompletableFuture.completedFuture(items(first, first + size - 1));
    }

    private static List<String> items(int first, int last) {
        return IntStream.rangeClosed(first, last)
                .mapToObj(e -> "i" + e)
                .collect(Collectors.toList());
    }

    private static long footerCount(PagingController<String> controller) {
        return controller.getEntries().stream()
                .filter(ListEntry::isFooter)
                .count();
    }

    private static void assertInvariants(PagingController<String> controller) {
        assertEquals(controller.getLoadingState() != LoadingState.DONE, controller.hasFooter(),
                "expected the footer to be present when the loading state is not DONE");
        assertTrue(footerCount(controller) <= 1, "expected at most one footer entry");

        if (controller.hasFooter()) {
            var last = controller.getItem(controller.getItemCount() - 1);
            assertTrue(last.map(ListEntry::isFooter).orElse(false), "expected the footer to be the last entry");
        }
    }
}
