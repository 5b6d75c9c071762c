package com.shortspilot.orchestrator.api;

import com.shortspilot.orchestrator.api.dto.ItemResponse;
import com.shortspilot.orchestrator.api.dto.StatsResponse;
import com.shortspilot.orchestrator.model.ItemStatus;
import com.shortspilot.orchestrator.model.WorkItem;
import com.shortspilot.orchestrator.service.PriorityOrder;
import com.shortspilot.orchestrator.store.TrackingStore;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the tracking store.
 *
 * GET /items[?status=] : tracked items in processing order
 * GET /items/{id}      : one item, 404 if unknown
 * GET /items/stats     : count per status
 */
@RestController
@RequestMapping("/items")
public class ItemController {

    private final TrackingStore store;

    public ItemController(TrackingStore store) {
        this.store = store;
    }

    /**
     * Example:
     *   curl 'http://localhost:8080/items?status=TRANSFORMED'
     */
    @GetMapping
    public List<ItemResponse> list(@RequestParam(required = false) ItemStatus status) {
        return store.load().values().stream()
                .filter(i -> status == null || i.getStatus() == status)
                .sorted(PriorityOrder.COMPARATOR)
                .map(ItemResponse::from)
                .toList();
    }

    @GetMapping("/stats")
    public StatsResponse stats() {
        Collection<WorkItem> items = store.load().values();
        Map<String, Long> byStatus = new LinkedHashMap<>();
        Arrays.stream(ItemStatus.values()).forEach(s -> byStatus.put(s.name(), 0L));
        items.forEach(i -> byStatus.merge(i.getStatus().name(), 1L, Long::sum));
        return new StatsResponse(items.size(), byStatus, store.corruptRecordIds().size());
    }

    @GetMapping("/{id}")
    public ItemResponse get(@PathVariable String id) {
        return store.find(id)
                .map(ItemResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Item not found: " + id));
    }
}
