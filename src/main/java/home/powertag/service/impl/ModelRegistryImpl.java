package home.powertag.service.impl;

import home.powertag.enums.PowerTagModel;
import home.powertag.model.ModelDescriptor;
import home.powertag.service.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class ModelRegistryImpl implements ModelRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ModelRegistryImpl.class);
    private final Map<Integer, ModelDescriptor> byTypeId;
    private final Map<String, ModelDescriptor> byReference;
    /* для поиска по префиксу: сначала самые длинные артикулы */
    private final List<ModelDescriptor> byReferenceLongestFirst;

    public ModelRegistryImpl() {
        List<ModelDescriptor> descriptors = Arrays.stream(PowerTagModel.values()).map(ModelDescriptor::new).toList();
        this.byTypeId = descriptors.stream()
            .collect(Collectors.toUnmodifiableMap(ModelDescriptor::getTypeId, Function.identity()));
        this.byReference = descriptors.stream()
            .collect(Collectors.toUnmodifiableMap(ModelDescriptor::getCommercialReference, Function.identity()));
        this.byReferenceLongestFirst = descriptors.stream()
            .sorted(Comparator.comparingInt((ModelDescriptor d) -> d.getCommercialReference().length()).reversed())
            .toList();
        logger.debug("Загружено моделей: {}", descriptors.size());
    }

    @Override
    public Optional<ModelDescriptor> lookupByTypeId(int typeId) {
        return Optional.ofNullable(byTypeId.get(typeId));
    }

    @Override
    public Optional<ModelDescriptor> lookupByCommercialReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String normalized = reference.trim().toUpperCase(Locale.ROOT);
        ModelDescriptor exact = byReference.get(normalized);
        if (exact != null) {
            return Optional.of(exact);
        }
        return byReferenceLongestFirst.stream()
            .filter(descriptor -> normalized.startsWith(descriptor.getCommercialReference()))
            .findFirst();
    }
}
