package win.ixuni.nimbus.server.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.reactivestreams.Publisher;
import org.springframework.core.ResolvableType;
import org.springframework.core.codec.AbstractEncoder;
import org.springframework.core.codec.EncodingException;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.lang.Nullable;
import org.springframework.util.MimeType;
import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * Jackson XML 编码器
 * <p>
 * WebFlux ships no Jackson XML codec; this one writes S3 wire documents.
 */
public class JacksonXmlEncoder extends AbstractEncoder<Object> {

    private final XmlMapper mapper;

    public JacksonXmlEncoder(XmlMapper mapper, MimeType... mimeTypes) {
        super(mimeTypes);
        this.mapper = mapper;
    }

    @Override
    public boolean canEncode(ResolvableType elementType, @Nullable MimeType mimeType) {
        Class<?> type = elementType.toClass();
        return super.canEncode(elementType, mimeType)
                && !CharSequence.class.isAssignableFrom(type)
                && this.mapper.canSerialize(type);
    }

    @Override
    public Flux<DataBuffer> encode(Publisher<?> inputStream, DataBufferFactory bufferFactory,
                                   ResolvableType elementType, @Nullable MimeType mimeType,
                                   @Nullable Map<String, Object> hints) {
        return Flux.from(inputStream)
                .map(value -> encodeValue(value, bufferFactory, elementType, mimeType, hints));
    }

    @Override
    public DataBuffer encodeValue(Object value, DataBufferFactory bufferFactory,
                                  ResolvableType valueType, @Nullable MimeType mimeType,
                                  @Nullable Map<String, Object> hints) {
        try {
            byte[] bytes = this.mapper.writeValueAsBytes(value);
            DataBuffer buffer = bufferFactory.allocateBuffer(bytes.length);
            buffer.write(bytes);
            return buffer;
        } catch (JsonProcessingException e) {
            throw new EncodingException("XML encoding error: " + e.getMessage(), e);
        }
    }
}
