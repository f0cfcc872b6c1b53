package com.github.yoep.paging.ui.view.controls;

import com.github.yoep.paging.core.model.FooterEntry;
import com.github.yoep.paging.core.model.FooterMarker;
import com.github.yoep.paging.core.model.ItemEntry;
import com.github.yoep.paging.core.model.ListEntry;
import com.github.yoep.paging.core.view.PagingView;
import com.github.yoep.paging.core.view.Placeholder;
import com.github.yoep.paging.ui.view.ObservableEntryList;
import javafx.application.Platform;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.SimpleObjectProperty;
import javafx.beans.property.SimpleStringProperty;
import javafx.beans.property.StringProperty;
import javafx.collections.ListChangeListener;
import javafx.scene.Node;
import javafx.scene.control.Label;
import javafx.scene.control.ListCell;
import javafx.scene.control.ListView;
import javafx.scene.control.ProgressIndicator;
import javafx.scene.control.skin.VirtualFlow;
import javafx.scene.layout.Region;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

/**
 * A {@link ListView} which renders a paginated collection.
 * The list view reports its last visible entry to the attached paging controller, which loads the next page once the end of
 * the list has become visible.
 * <p>
 * Items are rendered through the {@link ItemFactory}, the loading footer through the {@link LoaderFactory} and the error
 * footer as a label. Clicking the error footer retries the failed page, scrolling onto it doesn't.
 *
 * @param <T> The application item type.
 */
@Slf4j
public class InfiniteListView<T> extends ListView<ListEntry<T>> implements Placeholder {
    public static final String ITEM_FACTORY_PROPERTY = "itemFactory";
    public static final String LOADER_FACTORY_PROPERTY = "loaderFactory";
    public static final String ERROR_TEXT_PROPERTY = "errorText";
    public static final String EMPTY_NODE_PROPERTY = "emptyNode";
    public static final String STYLE_CLASS = "infinite-list-view";
    public static final String LOADER_STYLE_CLASS = "loader";
    public static final String ERROR_STYLE_CLASS = "error";

    private final ObservableEntryList<T> entryList = new ObservableEntryList<>();
    /**
     * The item factory which creates the graphic of each item in the list.
     */
    private final ObjectProperty<ItemFactory<T>> itemFactory = new SimpleObjectProperty<>(this, ITEM_FACTORY_PROPERTY);
    /**
     * The loader factory which creates the graphic of the loading footer.
     * A progress indicator is used when no loader factory has been set.
     */
    private final ObjectProperty<LoaderFactory> loaderFactory = new SimpleObjectProperty<>(this, LOADER_FACTORY_PROPERTY);
    private final StringProperty errorText = new SimpleStringProperty(this, ERROR_TEXT_PROPERTY, "Failed to load items, click to retry");
    /**
     * The node which is shown when the paginated collection is empty.
     */
    private final ObjectProperty<Node> emptyNode = new SimpleObjectProperty<>(this, EMPTY_NODE_PROPERTY, new Label("No items found"));

    private final Region hiddenPlaceholder = new Region();

    private int lastReportedIndex = -1;
    private int lastReportedSize = -1;
    private boolean reportPending;

    //region Constructors

    public InfiniteListView() {
        super();
        init();
    }

    //endregion

    //region Properties

    /**
     * Get the view which should be attached to the paging controller.
     *
     * @return Returns the paging view of this list.
     */
    public PagingView<T> getPagingView() {
        return entryList;
    }

    public ItemFactory<T> getItemFactory() {
        return itemFactory.get();
    }

    public ObjectProperty<ItemFactory<T>> itemFactoryProperty() {
        return itemFactory;
    }

    public void setItemFactory(ItemFactory<T> itemFactory) {
        Assert.notNull(itemFactory, "itemFactory cannot be null");
        this.itemFactory.set(itemFactory);
    }

    public LoaderFactory getLoaderFactory() {
        return loaderFactory.get();
    }

    public ObjectProperty<LoaderFactory> loaderFactoryProperty() {
        return loaderFactory;
    }

    public void setLoaderFactory(LoaderFactory loaderFactory) {
        this.loaderFactory.set(loaderFactory);
    }

    public String getErrorText() {
        return errorText.get();
    }

    public StringProperty errorTextProperty() {
        return errorText;
    }

    public void setErrorText(String errorText) {
        this.errorText.set(errorText);
    }

    public Node getEmptyNode() {
        return emptyNode.get();
    }

    public ObjectProperty<Node> emptyNodeProperty() {
        return emptyNode;
    }

    public void setEmptyNode(Node emptyNode) {
        this.emptyNode.set(emptyNode);
    }

    //endregion

    //region Placeholder

    @Override
    public void showPlaceholder() {
        log.trace("Showing the empty list placeholder");
        setPlaceholder(getEmptyNode());
    }

    @Override
    public void hidePlaceholder() {
        setPlaceholder(hiddenPlaceholder);
    }

    //endregion

    //region Functions

    @Override
    protected void layoutChildren() {
        super.layoutChildren();
        scheduleReport();
    }

    private void init() {
        getStyleClass().add(STYLE_CLASS);
        setItems(entryList.getEntries());
        setPlaceholder(hiddenPlaceholder);
        setCellFactory(param -> new EntryCell());

        entryList.getEntries().addListener((ListChangeListener<ListEntry<T>>) change -> requestLayout());
        skinProperty().addListener((observable, oldValue, newValue) -> {
            if (newValue != null)
                initializeScrollListener();
        });
    }

    private void initializeScrollListener() {
        if (lookup(".virtual-flow") instanceof VirtualFlow<?> flow) {
            flow.positionProperty().addListener((observable, oldValue, newValue) -> scheduleReport());
        } else {
            log.warn("Unable to find the virtual flow of {}, scroll positions won't be reported", this);
        }
    }

    // the entries may not be modified during a layout pass, so the report runs after the pulse
    private void scheduleReport() {
        if (reportPending)
            return;

        reportPending = true;
        Platform.runLater(() -> {
            reportPending = false;
            reportLastVisibleEntry();
        });
    }

    private void reportLastVisibleEntry() {
        if (!(lookup(".virtual-flow") instanceof VirtualFlow<?> flow))
            return;

        var lastVisibleCell = flow.getLastVisibleCell();
        if (lastVisibleCell == null)
            return;

        var index = lastVisibleCell.getIndex();
        var size = getItems().size();
        if (index < 0 || index >= size || isErrorFooter(getItems().get(index)))
            return;

        // only report changes of the visible range, a relayout of the same range shouldn't trigger a new page
        if (index == lastReportedIndex && size == lastReportedSize)
            return;

        lastReportedIndex = index;
        lastReportedSize = size;
        entryList.scrolled(index);
    }

    private static boolean isErrorFooter(ListEntry<?> entry) {
        return entry instanceof FooterEntry<?> footer && footer.marker() == FooterMarker.ERROR;
    }

    private void retry(int index) {
        log.debug("Retrying the page load of footer {}", index);
        entryList.scrolled(index);
    }

    private Node createItemNode(T item) {
        var factory = getItemFactory();

        if (factory == null) {
            return new Label(String.valueOf(item));
        }

        try {
            return factory.createNode(item);
        } catch (Exception ex) {
            log.error("Failed to create node for item {}, {}", item, ex.getMessage(), ex);
            return null;
        }
    }

    private Node createFooterNode(FooterMarker marker, int index) {
        if (marker == FooterMarker.ERROR) {
            var label = new Label(getErrorText());
            label.getStyleClass().add(ERROR_STYLE_CLASS);
            label.setOnMouseClicked(event -> retry(index));
            return label;
        }

        var factory = getLoaderFactory();
        Node loader = factory != null ? factory.get() : new ProgressIndicator();
        loader.getStyleClass().add(LOADER_STYLE_CLASS);
        return loader;
    }

    //endregion

    private class EntryCell extends ListCell<ListEntry<T>> {
        @Override
        protected void updateItem(ListEntry<T> entry, boolean empty) {
            super.updateItem(entry, empty);
            setText(null);

            if (empty || entry == null) {
                setGraphic(null);
                return;
            }

            switch (entry.getType()) {
                case ITEM -> setGraphic(createItemNode(((ItemEntry<T>) entry).item()));
                case FOOTER -> setGraphic(createFooterNode(((FooterEntry<T>) entry).marker(), getIndex()));
            }
        }
    }
}
