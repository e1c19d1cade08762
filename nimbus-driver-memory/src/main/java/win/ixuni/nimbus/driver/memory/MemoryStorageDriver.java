package win.ixuni.nimbus.driver.memory;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.nimbus.core.config.DriverConfig;
import win.ixuni.nimbus.core.driver.AbstractStorageDriver;
import win.ixuni.nimbus.core.operation.DriverContext;
import win.ixuni.nimbus.driver.memory.context.MemoryDriverContext;
import win.ixuni.nimbus.driver.memory.handler.bucket.MemoryBucketExistsHandler;
import win.ixuni.nimbus.driver.memory.handler.bucket.MemoryCreateBucketHandler;
import win.ixuni.nimbus.driver.memory.handler.bucket.MemoryDeleteBucketHandler;
import win.ixuni.nimbus.driver.memory.handler.bucket.MemoryListBucketsHandler;
import win.ixuni.nimbus.driver.memory.handler.multipart.MemoryAbortMultipartUploadHandler;
import win.ixuni.nimbus.driver.memory.handler.multipart.MemoryCompleteMultipartUploadHandler;
import win.ixuni.nimbus.driver.memory.handler.multipart.MemoryCreateMultipartUploadHandler;
import win.ixuni.nimbus.driver.memory.handler.multipart.MemoryListPartsHandler;
import win.ixuni.nimbus.driver.memory.handler.multipart.MemoryUploadPartHandler;
import win.ixuni.nimbus.driver.memory.handler.object.MemoryDeleteObjectHandler;
import win.ixuni.nimbus.driver.memory.handler.object.MemoryGetObjectHandler;
import win.ixuni.nimbus.driver.memory.handler.object.MemoryHeadObjectHandler;
import win.ixuni.nimbus.driver.memory.handler.object.MemoryListObjectsHandler;
import win.ixuni.nimbus.driver.memory.handler.object.MemoryPutObjectHandler;

/**
 * Memory 存储驱动
 * <p>
 * Keeps buckets, objects and pending multipart uploads in process memory. Every operation is
 * served by a registered handler.
 * <p>
 * Driver properties (resolved by {@link MemoryDriverFactory}):
 * <ul>
 *     <li>{@code min-part-size}: minimum size of every part but the last, default 5 MiB</li>
 *     <li>{@code strict-create}: reject CreateBucket for an existing bucket, default false</li>
 * </ul>
 */
@Slf4j
public class MemoryStorageDriver extends AbstractStorageDriver {

    @Getter
    private final DriverConfig config;

    private final MemoryDriverContext driverContext;

    public MemoryStorageDriver(DriverConfig config, long minPartSize, boolean strictCreate) {
        this.config = config;
        this.driverContext = MemoryDriverContext.builder()
                .config(config)
                .minPartSize(minPartSize)
                .strictCreate(strictCreate)
                .build();
        registerHandlers();
        driverContext.setHandlerRegistry(getHandlerRegistry());
    }

    private void registerHandlers() {
        getHandlerRegistry().register(new MemoryCreateBucketHandler());
        getHandlerRegistry().register(new MemoryDeleteBucketHandler());
        getHandlerRegistry().register(new MemoryBucketExistsHandler());
        getHandlerRegistry().register(new MemoryListBucketsHandler());

        getHandlerRegistry().register(new MemoryPutObjectHandler());
        getHandlerRegistry().register(new MemoryGetObjectHandler());
        getHandlerRegistry().register(new MemoryHeadObjectHandler());
        getHandlerRegistry().register(new MemoryDeleteObjectHandler());
        getHandlerRegistry().register(new MemoryListObjectsHandler());

        getHandlerRegistry().register(new MemoryCreateMultipartUploadHandler());
        getHandlerRegistry().register(new MemoryUploadPartHandler());
        getHandlerRegistry().register(new MemoryCompleteMultipartUploadHandler());
        getHandlerRegistry().register(new MemoryAbortMultipartUploadHandler());
        getHandlerRegistry().register(new MemoryListPartsHandler());

        log.info("Registered {} operation handlers for memory driver {}",
                getHandlerRegistry().size(), config.getName());
    }

    @Override
    public DriverContext getDriverContext() {
        return driverContext;
    }

    @Override
    public String getDriverType() {
        return MemoryDriverFactory.DRIVER_TYPE;
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public Mono<Void> initialize() {
        log.info("Initializing memory storage driver: {} (min part size {} bytes)",
                config.getName(), driverContext.getMinPartSize());
        return Mono.empty();
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Shutting down memory storage driver: {}", config.getName());
        driverContext.getBuckets().clear();
        driverContext.getMultipartUploads().clear();
        return Mono.empty();
    }
}
