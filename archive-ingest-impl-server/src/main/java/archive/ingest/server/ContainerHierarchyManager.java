package archive.ingest.server;

import archive.ingest.common.Container;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Persists the container tree of a multi-file request, and its aggregated sizes once the files are known.
 */
public class ContainerHierarchyManager {
    private static final Logger logger = LoggerFactory.getLogger(ContainerHierarchyManager.class);

    private final ArchiveCatalogBackend catalog;
    private final Clock clock;

    public ContainerHierarchyManager(ArchiveCatalogBackend catalog, Clock clock) {
        this.catalog = Objects.requireNonNull(catalog);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Persists a container and all its descendants, parents before children. Each container is created with
     * size 0; the catalog-issued IDs are recorded on the in-memory nodes.
     *
     * @param container the (sub)tree to persist
     * @param parentId  catalog ID of the parent of {@code container}, null for a root container
     * @throws CatalogException if the catalog rejects a container
     */
    public void createContainers(Container container, String parentId) {
        Instant ingestionDate = clock.instant();
        String containerId = catalog.createContainer(container.getName(), parentId, 0L, ingestionDate);
        container.assignIdentity(containerId, parentId, ingestionDate);
        logger.debug("Created container {} (ID {}, parent {})", container.getName(), containerId, parentId);
        for (Container child : container.getChildren()) {
            createContainers(child, containerId);
        }
    }

    /**
     * Rolls up per-container file sizes through the tree and writes the resulting size of every container
     * that has at least one file in its subtree.
     *
     * @param root        root of the tree
     * @param directSizes total size of the files directly in a container, keyed by container index
     * @throws CatalogException if the catalog rejects an update
     */
    public void updateContainerSizes(Container root, Map<Integer, Long> directSizes) {
        rollUp(root, directSizes);
    }

    // Returns whether the subtree contains files.
    private boolean rollUp(Container container, Map<Integer, Long> directSizes) {
        Long direct = directSizes.get(container.getIndex());
        boolean hasFiles = direct != null;
        long size = hasFiles ? direct : 0L;
        for (Container child : container.getChildren()) {
            if (rollUp(child, directSizes)) {
                hasFiles = true;
                size += child.getSize();
            }
        }
        container.setSize(size);
        if (hasFiles && container.isPersisted()) {
            catalog.setContainerSize(container.getContainerId(), size);
            logger.debug("Container {} ({}) has size {}", container.getName(), container.getContainerId(), size);
        }
        return hasFiles;
    }
}
