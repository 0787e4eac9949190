package crackmonitor.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import crackmonitor.config.StrainProfileConfig;
import crackmonitor.domain.crack.Crack;
import crackmonitor.domain.crack.CrackList;
import crackmonitor.domain.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Conversión entre texto JSON y los objetos del análisis.
 * <p>
 * Lee configuraciones de perfil y escribe informes de fisuras. Trabaja solo con cadenas:
 * leer o escribir ficheros queda en manos del llamador.
 */
@Slf4j
public class AnalysisJsonMapper {

    // El ObjectMapper es costoso de crear y thread-safe: se comparte.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Reconstruye una configuración de perfil desde JSON. Las secciones ausentes toman sus valores por defecto.
     *
     * @param json Texto JSON.
     * @return La configuración leída.
     * @throws ConfigurationException si el JSON está mal formado o contiene un nombre de regla,
     *                                sensor o modelo desconocido.
     */
    public StrainProfileConfig readConfig(String json) {
        Objects.requireNonNull(json, "El JSON de configuración no puede ser nulo.");
        log.debug("Leyendo configuración de perfil desde JSON ({} caracteres)", json.length());
        try {
            return objectMapper.readValue(json, StrainProfileConfig.class);
        } catch (JsonProcessingException e) {
            ConfigurationException configurationError = findConfigurationCause(e);
            if (configurationError != null) {
                log.error("Configuración inválida: {}", configurationError.getMessage());
                throw configurationError;
            }
            log.error("Error al interpretar el JSON de configuración", e);
            throw new ConfigurationException("JSON de configuración no válido: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Serializa una configuración de perfil a JSON.
     */
    public String writeConfig(StrainProfileConfig config) {
        Objects.requireNonNull(config, "La configuración no puede ser nula.");
        try {
            return objectMapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            log.error("Error al serializar la configuración '{}'", config.name(), e);
            throw new ConfigurationException("No se pudo serializar la configuración.", e);
        }
    }

    /**
     * Informe de fisuras: un array JSON con un objeto por fisura. Incluye los atributos fijos,
     * la longitud de transferencia {@code lt} y los atributos de extensión.
     */
    public String writeReport(CrackList crackList) {
        Objects.requireNonNull(crackList, "La lista de fisuras no puede ser nula.");
        List<Map<String, Object>> rows = new ArrayList<>(crackList.size());
        for (Crack crack : crackList) {
            rows.add(toReportRow(crack));
        }
        try {
            return objectMapper.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            log.error("Error al serializar el informe de {} fisuras", crackList.size(), e);
            throw new IllegalStateException("No se pudo serializar el informe de fisuras.", e);
        }
    }

    private Map<String, Object> toReportRow(Crack crack) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(Crack.INDEX, crack.getIndex());
        row.put(Crack.LOCATION, finiteOrNull(crack.getLocation()));
        row.put(Crack.X_L, finiteOrNull(crack.getXL()));
        row.put(Crack.X_R, finiteOrNull(crack.getXR()));
        row.put("lt", finiteOrNull(crack.getLt()));
        row.put(Crack.MAX_STRAIN, crack.getMaxStrain());
        row.put(Crack.WIDTH, crack.getWidth());
        row.put(Crack.NAME, crack.getName());
        row.putAll(crack.getExtensions());
        return row;
    }

    // JSON no admite infinitos: un límite no acotado se informa como null
    private static Double finiteOrNull(Double value) {
        return value == null || value.isInfinite() || value.isNaN() ? null : value;
    }

    private static ConfigurationException findConfigurationCause(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ConfigurationException configurationException) {
                return configurationException;
            }
            current = current.getCause();
        }
        return null;
    }
}
