package archive.ingest.server;

import archive.ingest.common.Volume;

import java.util.List;
import java.util.Optional;

/**
 * Chooses the target volume of an archive request among the volumes of the local host.
 */
public interface VolumeSelector {

    /**
     * @param volumes volumes of the host, as listed by the catalog
     * @return the selected volume, or empty if none is available
     */
    Optional<Volume> select(List<Volume> volumes);
}
