package win.ixuni.nimbus.server.config;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import win.ixuni.nimbus.core.util.XmlMappers;
import win.ixuni.nimbus.server.codec.JacksonXmlDecoder;
import win.ixuni.nimbus.server.codec.JacksonXmlEncoder;

/**
 * WebFlux 配置
 * <p>
 * Registers the XML codecs for S3 documents. Request documents are also accepted without a
 * declared content type, which arrives as application/octet-stream.
 */
@Configuration
public class WebFluxConfig implements WebFluxConfigurer {

    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        XmlMapper xmlMapper = XmlMappers.create();

        configurer.customCodecs().register(
                new JacksonXmlEncoder(xmlMapper, MediaType.APPLICATION_XML, MediaType.TEXT_XML));
        configurer.customCodecs().register(
                new JacksonXmlDecoder(xmlMapper, MediaType.APPLICATION_XML, MediaType.TEXT_XML,
                        MediaType.APPLICATION_OCTET_STREAM));
    }
}
