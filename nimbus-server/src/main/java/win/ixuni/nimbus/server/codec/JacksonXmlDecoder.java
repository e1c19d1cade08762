package win.ixuni.nimbus.server.codec;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.reactivestreams.Publisher;
import org.springframework.core.ResolvableType;
import org.springframework.core.codec.AbstractDecoder;
import org.springframework.core.codec.DecodingException;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.lang.Nullable;
import org.springframework.util.MimeType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Jackson XML 解码器
 * <p>
 * Buffers the whole request body, then binds it to the target type.
 */
public class JacksonXmlDecoder extends AbstractDecoder<Object> {

    private final XmlMapper mapper;

    public JacksonXmlDecoder(XmlMapper mapper, MimeType... mimeTypes) {
        super(mimeTypes);
        this.mapper = mapper;
    }

    @Override
    public boolean canDecode(ResolvableType elementType, @Nullable MimeType mimeType) {
        Class<?> type = elementType.toClass();
        return super.canDecode(elementType, mimeType)
                && !CharSequence.class.isAssignableFrom(type)
                && this.mapper.canDeserialize(this.mapper.constructType(elementType.getType()));
    }

    @Override
    public Flux<Object> decode(Publisher<DataBuffer> inputStream, ResolvableType elementType,
                               @Nullable MimeType mimeType, @Nullable Map<String, Object> hints) {
        return decodeToMono(inputStream, elementType, mimeType, hints).flux();
    }

    @Override
    public Mono<Object> decodeToMono(Publisher<DataBuffer> inputStream, ResolvableType elementType,
                                     @Nullable MimeType mimeType, @Nullable Map<String, Object> hints) {
        JavaType javaType = this.mapper.constructType(elementType.getType());
        return DataBufferUtils.join(inputStream)
                .flatMap(dataBuffer -> {
                    try (InputStream is = dataBuffer.asInputStream()) {
                        return Mono.justOrEmpty(this.mapper.readValue(is, javaType));
                    } catch (IOException e) {
                        return Mono.error(new DecodingException("XML decoding error: " + e.getMessage(), e));
                    } finally {
                        DataBufferUtils.release(dataBuffer);
                    }
                });
    }
}
