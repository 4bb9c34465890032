package waterquality.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link ObjectMapper} compartido por las conversiones objeto &lt;-&gt; diccionario y la E/S JSON.
 * Es costoso de crear y thread-safe una vez configurado, así que hay uno solo.
 */
public final class JsonMapping {

    private static final ObjectMapper MAPPER = createConfiguredObjectMapper();

    private static final TypeReference<LinkedHashMap<String, Object>> DICT = new TypeReference<>() {
    };

    private JsonMapping() {
    }

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        return mapper;
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Convierte un bean anotado con Jackson a un mapa ordenado de datos planos.
     */
    public static Map<String, Object> toDict(Object bean) {
        return MAPPER.convertValue(bean, DICT);
    }
}
