package win.ixuni.nimbus.core.model;

import lombok.Builder;
import lombok.Data;
import reactor.core.publisher.Flux;

import java.nio.ByteBuffer;

/**
 * Object 数据（包含元数据和内容流）
 */
@Data
@Builder
public class StorageObjectData {

    private StorageObject metadata;

    /**
     * Object content stream
     */
    private Flux<ByteBuffer> content;
}
