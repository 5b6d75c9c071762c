package com.shortspilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One discovered source video, tracked from discovery to publication.
 *
 * The scheduler advances a WorkItem one stage at a time and commits it to the
 * tracking store after every change. All mutators enforce the lifecycle rules:
 * status only moves forward (or to FAILED), segments are set once, and
 * published refs are append-only.
 *
 * Persisted as one JSON object per item; Jackson reads and writes the fields
 * directly so that the getters below can hand out read-only views.
 */
@JsonAutoDetect(fieldVisibility = Visibility.ANY,
                getterVisibility = Visibility.NONE,
                isGetterVisibility = Visibility.NONE,
                setterVisibility = Visibility.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkItem {

    private String id;

    private String title;

    // Where the fetch stage downloads the source from.
    private String sourceUrl;

    // Popularity metric reported by discovery (view count). Higher goes first.
    private long priority;

    private ItemStatus status = ItemStatus.DISCOVERED;

    // Set by the fetch stage; consumed by transform.
    private String sourceArtifactRef;
    private double sourceDurationSeconds;

    private List<Segment> segments = new ArrayList<>();

    // segment index -> remote id on the publishing platform
    private SortedMap<Integer, String> publishedRefs = new TreeMap<>();

    private int retryCount = 0;

    private String lastError;

    private Instant createdAt;

    private Instant updatedAt;

    // Bumped by the tracking store on every successful commit of this record.
    private long version = 0;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected WorkItem() {}   // required by Jackson

    public WorkItem(String id, String title, String sourceUrl, long priority, Instant createdAt) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
        this.id        = id;
        this.title     = title;
        this.sourceUrl = sourceUrl;
        this.priority  = priority;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String     getId()                    { return id; }
    public String     getTitle()                 { return title; }
    public String     getSourceUrl()             { return sourceUrl; }
    public long       getPriority()              { return priority; }
    public ItemStatus getStatus()                { return status; }
    public String     getSourceArtifactRef()     { return sourceArtifactRef; }
    public double     getSourceDurationSeconds() { return sourceDurationSeconds; }
    public int        getRetryCount()            { return retryCount; }
    public String     getLastError()             { return lastError; }
    public Instant    getCreatedAt()             { return createdAt; }
    public Instant    getUpdatedAt()             { return updatedAt; }
    public long       getVersion()               { return version; }

    public List<Segment> getSegments() {
        return Collections.unmodifiableList(segments);
    }

    public SortedMap<Integer, String> getPublishedRefs() {
        return Collections.unmodifiableSortedMap(publishedRefs);
    }

    // Maintained by the tracking store only.
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public void setVersion(long version)        { this.version = version; }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    public void advanceTo(ItemStatus next) {
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateTransitionException(
                    "Item " + id + ": illegal transition " + status + " -> " + next);
        }
        this.status = next;
    }

    public void markFetched(String artifactRef, double durationSeconds) {
        advanceTo(ItemStatus.FETCHED);
        this.sourceArtifactRef     = artifactRef;
        this.sourceDurationSeconds = durationSeconds;
    }

    public void markTransformed(List<Segment> produced) {
        if (!segments.isEmpty()) {
            throw new IllegalStateTransitionException("Item " + id + ": segments are already set");
        }
        if (produced == null || produced.isEmpty()) {
            throw new IllegalArgumentException("Item " + id + ": transform produced no segments");
        }
        advanceTo(ItemStatus.TRANSFORMED);
        List<Segment> ordered = new ArrayList<>(produced);
        ordered.sort(Comparator.comparingInt(Segment::index));
        this.segments = ordered;
    }

    /**
     * Record the remote id of a published segment. An index can be recorded
     * once; a second call for the same index is a programming error.
     */
    public void recordPublished(int index, String remoteId) {
        if (status != ItemStatus.TRANSFORMED) {
            throw new IllegalStateTransitionException(
                    "Item " + id + ": cannot publish in state " + status);
        }
        if (segments.stream().noneMatch(s -> s.index() == index)) {
            throw new IllegalArgumentException("Item " + id + ": no segment with index " + index);
        }
        if (publishedRefs.containsKey(index)) {
            throw new IllegalStateTransitionException(
                    "Item " + id + ": segment " + index + " is already published as "
                    + publishedRefs.get(index));
        }
        publishedRefs.put(index, remoteId);
    }

    /** Segments without a published ref, in index order. */
    public List<Segment> pendingSegments() {
        return segments.stream()
                .filter(s -> !publishedRefs.containsKey(s.index()))
                .sorted(Comparator.comparingInt(Segment::index))
                .toList();
    }

    public boolean allSegmentsPublished() {
        return !segments.isEmpty() && pendingSegments().isEmpty();
    }

    /** Count a failed attempt without changing status. */
    public void recordFailure(String error) {
        this.retryCount++;
        this.lastError = error;
    }

    /** Terminate the item. lastError is kept for operator inspection. */
    public void fail(String error) {
        advanceTo(ItemStatus.FAILED);
        this.lastError = error;
    }

    public void resetRetries() {
        this.retryCount = 0;
    }

    public void updatePriority(long priority) {
        this.priority = priority;
    }

    @Override
    public String toString() {
        return "WorkItem{id=" + id + ", status=" + status + ", priority=" + priority
                + ", published=" + publishedRefs.size() + "/" + segments.size()
                + ", retryCount=" + retryCount + ", version=" + version + "}";
    }
}
