package com.catalog.reconciliation.publish;

import com.catalog.reconciliation.api.Page;
import com.catalog.reconciliation.api.PageRequest;
import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.core.model.CatalogView;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The two read views consumers query. Both are replaced together in a single atomic
 * swap, so a reader never sees a half-published run.
 */
public class PublishedCatalog {

    private final AtomicReference<Views> views =
            new AtomicReference<>(new Views(CatalogSnapshot.empty(), CatalogSnapshot.empty()));

    public CatalogSnapshot current(CatalogView view) {
        Views current = views.get();
        return view == CatalogView.PRODUCTION ? current.production() : current.preview();
    }

    public Optional<CanonicalProduct> find(CatalogView view, String productKey) {
        return current(view).find(productKey);
    }

    /**
     * One page of a view, in product key order.
     */
    public Page<CanonicalProduct> list(CatalogView view, PageRequest request) {
        return Page.of(current(view).getProducts(), request);
    }

    /**
     * Replaces the preview view, and the production view when {@code production} is non-null.
     */
    void swap(CatalogSnapshot preview, CatalogSnapshot production) {
        views.updateAndGet(old -> new Views(preview, production != null ? production : old.production()));
    }

    private record Views(CatalogSnapshot preview, CatalogSnapshot production) {
    }
}
