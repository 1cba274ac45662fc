package com.cloudgov.infrastructure.repository.hierarchy;

import com.cloudgov.domain.hierarchy.adapter.repository.IProviderHierarchyRepository;
import com.cloudgov.domain.hierarchy.model.valobj.HierarchyLevelDef;
import com.cloudgov.domain.hierarchy.model.valobj.ProviderHierarchy;
import com.cloudgov.infrastructure.dao.po.HierarchyLevelPO;
import com.cloudgov.infrastructure.dao.po.ProviderHierarchyCatalogPO;
import com.cloudgov.infrastructure.dao.po.ProviderHierarchyPO;
import com.cloudgov.infrastructure.util.JsonCodec;
import com.cloudgov.types.enums.ResponseCode;
import com.cloudgov.types.exception.AppException;
import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 云厂商层级定义仓储实现类。
 * <p>
 * 启动时从类路径 hierarchy/provider-hierarchies.json 加载一次，之后只读。
 * 名称查找忽略大小写。
 * </p>
 */
@Slf4j
@Repository
public class ProviderHierarchyRepositoryImpl implements IProviderHierarchyRepository {

    static final String DEFAULT_RESOURCE = "hierarchy/provider-hierarchies.json";

    private final ImmutableMap<String, ProviderHierarchy> hierarchies;

    public ProviderHierarchyRepositoryImpl(JsonCodec jsonCodec) {
        this(jsonCodec, DEFAULT_RESOURCE);
    }

    ProviderHierarchyRepositoryImpl(JsonCodec jsonCodec, String resourcePath) {
        this.hierarchies = load(jsonCodec, resourcePath);
        log.info("PROVIDER_HIERARCHY_LOADED resource={}, providers={}", resourcePath, hierarchies.keySet());
    }

    @Override
    public ProviderHierarchy findByProvider(String providerName) {
        if (StringUtils.isBlank(providerName)) {
            return null;
        }
        return hierarchies.get(providerName.trim().toLowerCase(Locale.ROOT));
    }

    @Override
    public List<ProviderHierarchy> findAll() {
        return new ArrayList<>(hierarchies.values());
    }

    private ImmutableMap<String, ProviderHierarchy> load(JsonCodec jsonCodec, String resourcePath) {
        ClassLoader classLoader = ProviderHierarchyRepositoryImpl.class.getClassLoader();
        try (InputStream inputStream = classLoader.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new AppException(ResponseCode.UN_ERROR.getCode(), "Provider hierarchy resource not found: " + resourcePath);
            }
            ProviderHierarchyCatalogPO catalog = jsonCodec.readValue(inputStream, ProviderHierarchyCatalogPO.class);
            ImmutableMap.Builder<String, ProviderHierarchy> builder = ImmutableMap.builder();
            if (catalog != null && catalog.getProviders() != null) {
                for (ProviderHierarchyPO po : catalog.getProviders()) {
                    ProviderHierarchy hierarchy = toValueObject(po);
                    builder.put(hierarchy.getProviderName(), hierarchy);
                }
            }
            return builder.buildOrThrow();
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to read provider hierarchy resource", ex);
        }
    }

    private ProviderHierarchy toValueObject(ProviderHierarchyPO po) {
        List<HierarchyLevelDef> levels = new ArrayList<>();
        if (po.getLevels() != null) {
            for (HierarchyLevelPO levelPO : po.getLevels()) {
                levels.add(HierarchyLevelDef.builder()
                        .typeId(levelPO.getTypeId())
                        .label(levelPO.getLabel())
                        .icon(levelPO.getIcon())
                        .allowedChildren(levelPO.getAllowedChildren())
                        .supportsTags(Boolean.TRUE.equals(levelPO.getSupportsTags()))
                        .supportsIpam(Boolean.TRUE.equals(levelPO.getSupportsIpam()))
                        .supportsEnvironment(Boolean.TRUE.equals(levelPO.getSupportsEnvironment()))
                        .build());
            }
        }
        return new ProviderHierarchy(po.getProviderName(), po.getRootType(), levels);
    }
}
