package watchtower.monitor.model;

/**
 * Kind-specific payload of a {@link Detection}.
 */
public interface DetectionDetails {

    /** The tag this payload belongs to. */
    DetectionKind kind();
}
