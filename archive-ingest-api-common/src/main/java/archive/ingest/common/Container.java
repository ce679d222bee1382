package archive.ingest.common;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, hierarchical grouping of files created within one multi-file archive request.
 * <p>
 * Containers form a strict tree: a node knows its children, never its parent object. While a request
 * is being parsed, nodes are only identified by their in-memory {@link #getIndex() index}, which is unique
 * within the tree. The catalog-issued {@link #getContainerId() container ID} (and, with it, the
 * {@link #getParentId() parent ID}) only becomes known once the node has been persisted, which always happens
 * parent-first.
 * <p>
 * The size is the aggregate size of all files in the subtree. It is persisted as 0 at creation time and
 * written once the member files are known.
 */
public class Container {

    private final int index;
    private final String name;
    private final List<Container> children = new ArrayList<>();

    private String containerId;
    private String parentId;
    private long size;
    private Instant ingestionDate;

    public Container(int index, String name) {
        this.index = index;
        this.name = Objects.requireNonNull(name, "Container name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Container name must not be empty");
        }
    }

    /**
     * @return the in-memory index, unique within one container tree
     */
    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    /**
     * Appends a child container. Children keep their insertion order.
     *
     * @param child the child to add
     * @return the child
     */
    public Container addChild(Container child) {
        children.add(Objects.requireNonNull(child));
        return child;
    }

    public List<Container> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * @return the catalog-issued ID, or {@code null} if the container was not persisted yet
     */
    public String getContainerId() {
        return containerId;
    }

    public boolean isPersisted() {
        return containerId != null;
    }

    /**
     * Records the result of persisting this container.
     *
     * @param containerId   catalog-issued ID
     * @param parentId      catalog-issued ID of the parent, {@code null} for a root container
     * @param ingestionDate moment of persistence
     */
    public void assignIdentity(String containerId, String parentId, Instant ingestionDate) {
        if (this.containerId != null) {
            throw new IllegalStateException("Container " + name + " already has ID " + this.containerId);
        }
        this.containerId = Objects.requireNonNull(containerId, "Container ID must not be null");
        this.parentId = parentId;
        this.ingestionDate = ingestionDate;
    }

    public String getParentId() {
        return parentId;
    }

    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    public Instant getIngestionDate() {
        return ingestionDate;
    }

    /**
     * Returns this container and all its descendants in pre-order (parents before children).
     *
     * @return the flattened tree
     */
    public List<Container> flatten() {
        List<Container> result = new ArrayList<>();
        collect(this, result);
        return result;
    }

    private static void collect(Container container, List<Container> result) {
        result.add(container);
        for (Container child : container.children) {
            collect(child, result);
        }
    }

    @Override
    public String toString() {
        return "Container{" +
                "index=" + index +
                ", name='" + name + '\'' +
                ", containerId='" + containerId + '\'' +
                ", parentId='" + parentId + '\'' +
                ", size=" + size +
                ", children=" + children.size() +
                '}';
    }
}
