package com.trailvision.core.geo;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Небольшое изменяемое хранилище метаданных кластеров, независимое от bulk-данных.
 * Переименование или правка центра не трогает исторические наблюдения.
 *
 * Батчи транзакционны: либо все точки записаны и mean/pointCount обновлены, либо ничего.
 * Читатели видят запись кластера целиком, до или после обновления.
 */
public interface ClusterMetadataStore {

    Optional<Cluster> get(String clusterId);

    /** false, если кластера нет. */
    boolean upsertName(String clusterId, String name, String description);

    default boolean upsertName(String clusterId, String name) {
        return upsertName(clusterId, name, null);
    }

    /**
     * Добавить точки к кластеру (running mean по порядку точек).
     * Если кластера нет, он создаётся с центром в первой точке.
     */
    Cluster batchUpsertLocations(String clusterId, List<GeoPoint> points);

    /** То же, что batchUpsertLocations, плюс строки назначений в одной транзакции. */
    Cluster batchUpsertAssignments(String clusterId, List<ClusterAssignment> assignments);

    List<Cluster> allClusters();

    /** Подмножество candidateIds, которых нет в хранилище. */
    Set<String> unknownClusters(Set<String> candidateIds);

    /** Кластеры без имени, самые «населённые» первыми. */
    List<Cluster> unnamedClusters();

    Optional<Cluster> findByName(String name);

    List<ClusterAssignment> assignments(String clusterId);

    /** Только для явного обслуживания; в обычном прогоне кластеры не удаляются. */
    boolean deleteCluster(String clusterId);

    /**
     * Слить кластеры одной транзакцией. Выживает меньший id, его центр
     * пересчитывается по всем точкам; назначения и точки остальных переносятся
     * на него, сами они удаляются и остаются alias'ами выжившего.
     *
     * @param name null — сохранить имя выжившего (или первого названного)
     * @throws IllegalArgumentException меньше двух различных id или какого-то id нет в хранилище
     */
    Cluster mergeClusters(Collection<String> clusterIds, String name, String description);

    /** Влитый id → id кластера, в который он влит. */
    Map<String, String> aliases();

    /**
     * Вставить готовый кластер (импорт из выгрузки).
     *
     * @return false, если id уже занят кластером или alias'ом; хранилище не меняется
     */
    boolean importCluster(Cluster cluster);

    /** Полностью заменить кэш активности кластеров. */
    void replaceActivity(List<ClusterActivity> activity);

    Map<String, ClusterActivity> activity();
}
