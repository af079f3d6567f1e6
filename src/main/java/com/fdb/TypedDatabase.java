package com.fdb;

import com.fdb.columns.BehaviorParameterColumn;
import com.fdb.columns.BehaviorTemplateColumn;
import com.fdb.columns.ComponentsRegistryColumn;
import com.fdb.columns.DestructibleComponentColumn;
import com.fdb.columns.IconsColumn;
import com.fdb.columns.ItemSetSkillsColumn;
import com.fdb.columns.ItemSetsColumn;
import com.fdb.columns.LootTableColumn;
import com.fdb.columns.MissionTasksColumn;
import com.fdb.columns.MissionsColumn;
import com.fdb.columns.ObjectSkillsColumn;
import com.fdb.columns.ObjectsColumn;
import com.fdb.columns.RebuildComponentColumn;
import com.fdb.columns.RenderComponentColumn;
import com.fdb.columns.SkillBehaviorColumn;
import com.fdb.core.ColumnMap;
import com.fdb.core.Lookups;
import com.fdb.core.TypedTable;
import com.fdb.error.ErrorType;
import com.fdb.error.FdbException;
import com.fdb.ext.Components;
import com.fdb.ext.Mission;
import com.fdb.ext.MissionTask;
import com.fdb.ext.ObjectNameDesc;
import com.fdb.ext.ObjectsLayout;
import com.fdb.mem.Row;
import com.fdb.mem.Table;
import com.fdb.mem.Tables;
import com.fdb.tables.BehaviorParameterTable;
import com.fdb.tables.BehaviorTemplateTable;
import com.fdb.tables.ItemSetSkillsTable;
import com.fdb.tables.MissionTasksTable;
import com.fdb.tables.MissionsTable;
import com.fdb.tables.ObjectSkillsTable;
import com.fdb.tables.SkillBehaviorTable;
import com.fdb.types.Field;
import com.fdb.types.Latin1Str;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A selection of typed tables from an opened store, plus the derived queries built on them.
 * <p>
 * Every point query hashes its key with {@link Lookups} and scans one bucket. The queries differ in which
 * matching rows they use: the first, the last, or all of them. Each query documents its policy.
 * <p>
 * The database holds no mutable state and may be shared between threads for as long as the store is open.
 * Returned {@link Latin1Str} views borrow from the store.
 */
@Getter
public final class TypedDatabase {
    private static final Logger log = LoggerFactory.getLogger(TypedDatabase.class);

    private final BehaviorParameterTable behaviorParameters;
    private final BehaviorTemplateTable behaviorTemplates;
    private final TypedTable<ComponentsRegistryColumn> compReg;
    private final TypedTable<DestructibleComponentColumn> destructibleComponent;
    private final TypedTable<IconsColumn> icons;
    private final TypedTable<ItemSetsColumn> itemSets;
    private final ItemSetSkillsTable itemSetSkills;
    private final TypedTable<LootTableColumn> lootTable;
    private final MissionsTable missions;
    private final MissionTasksTable missionTasks;
    private final TypedTable<ObjectsColumn> objects;
    private final ObjectSkillsTable objectSkills;
    private final TypedTable<RebuildComponentColumn> rebuildComponent;
    private final TypedTable<RenderComponentColumn> renderComp;
    private final SkillBehaviorTable skills;

    private TypedDatabase(Tables tables) throws FdbException {
        this.behaviorParameters = new BehaviorParameterTable(require(tables, BehaviorParameterColumn.TABLE_NAME));
        this.behaviorTemplates = new BehaviorTemplateTable(require(tables, BehaviorTemplateColumn.TABLE_NAME));
        this.compReg = new TypedTable<>(require(tables, ComponentsRegistryColumn.TABLE_NAME), ComponentsRegistryColumn.class);
        this.destructibleComponent = new TypedTable<>(require(tables, DestructibleComponentColumn.TABLE_NAME), DestructibleComponentColumn.class);
        this.icons = new TypedTable<>(require(tables, IconsColumn.TABLE_NAME), IconsColumn.class);
        this.itemSets = new TypedTable<>(require(tables, ItemSetsColumn.TABLE_NAME), ItemSetsColumn.class);
        this.itemSetSkills = new ItemSetSkillsTable(require(tables, ItemSetSkillsColumn.TABLE_NAME));
        this.lootTable = new TypedTable<>(require(tables, LootTableColumn.TABLE_NAME), LootTableColumn.class);
        this.missions = new MissionsTable(require(tables, MissionsColumn.TABLE_NAME));
        this.missionTasks = new MissionTasksTable(require(tables, MissionTasksColumn.TABLE_NAME));
        this.objects = new TypedTable<>(require(tables, ObjectsColumn.TABLE_NAME), ObjectsColumn.class);
        this.objectSkills = new ObjectSkillsTable(require(tables, ObjectSkillsColumn.TABLE_NAME));
        this.rebuildComponent = new TypedTable<>(require(tables, RebuildComponentColumn.TABLE_NAME), RebuildComponentColumn.class);
        this.renderComp = new TypedTable<>(require(tables, RenderComponentColumn.TABLE_NAME), RenderComponentColumn.class);
        this.skills = new SkillBehaviorTable(require(tables, SkillBehaviorColumn.TABLE_NAME));
    }

    /**
     * Bind all typed tables to an opened store.
     *
     * @throws FdbException with {@link ErrorType#TABLE_NOT_FOUND} or {@link ErrorType#COLUMN_NOT_FOUND} for the
     *                      first table or required column the store does not have
     */
    public static TypedDatabase open(Tables tables) throws FdbException {
        Objects.requireNonNull(tables, "Tables cannot be null");
        var db = new TypedDatabase(tables);
        log.info("Opened typed database over {} store tables", tables.tableNames().size());
        return db;
    }

    private static Table require(Tables tables, String name) throws FdbException {
        var table = tables.byName(name);
        if (table == null)
            throw new FdbException(ErrorType.TABLE_NOT_FOUND, "Missing table '" + name + "'");
        log.debug("Binding table '{}' ({} columns, {} buckets)", name, table.columnNames().size(), table.bucketCount());
        return table;
    }

    // ========== DERIVED QUERIES ==========

    /**
     * Get the path of an icon. First match wins.
     *
     * @return the path, empty if the icon does not exist, the table has no {@code IconPath} column or the path
     * is not text
     */
    public Optional<Latin1Str> getIconPath(int id) {
        var bucket = Lookups.bucketFor(icons.asRaw(), id);
        if (bucket == null) return Optional.empty();

        int colIconPath = icons.getColumns().indexOf(IconsColumn.ICON_PATH);
        for (var row : bucket.rows()) {
            if (Lookups.keyMatches(row, Constants.KEY_COLUMN, id)) {
                if (colIconPath == ColumnMap.ABSENT) return Optional.empty();
                return Optional.ofNullable(text(row, colIconPath));
            }
        }
        return Optional.empty();
    }

    /**
     * Get the icon and mission flag of a mission. First match wins.
     * A mission without a stored {@code isMission} value counts as a mission.
     */
    public Optional<Mission> getMissionData(int id) {
        var bucket = Lookups.bucketFor(missions.asRaw(), id);
        if (bucket == null) return Optional.empty();

        int colMissionIconId = missions.getColumns().indexOf(MissionsColumn.MISSION_ICON_ID);
        int colIsMission = missions.getColumns().require(MissionsColumn.IS_MISSION);
        for (var row : bucket.rows()) {
            if (Lookups.keyMatches(row, Constants.KEY_COLUMN, id)) {
                var missionIconId = colMissionIconId == ColumnMap.ABSENT ? null : integer(row, colMissionIconId);
                var isMissionField = row.fieldAt(colIsMission);
                var isMission = isMissionField == null ? null : isMissionField.asBoolean();
                return Optional.of(new Mission(missionIconId, isMission == null || isMission));
            }
        }
        return Optional.empty();
    }

    /**
     * Get all tasks of a mission, in stored order. Every matching row contributes one task, duplicates included.
     *
     * @throws IllegalStateException if a matching row has no integer {@code uid}
     */
    public List<MissionTask> getMissionTasks(int id) {
        var tasks = new ArrayList<MissionTask>(4);
        var bucket = Lookups.bucketFor(missionTasks.asRaw(), id);
        if (bucket == null) return tasks;

        int colIconId = missionTasks.getColumns().indexOf(MissionTasksColumn.ICON_ID);
        int colUid = missionTasks.getColumns().require(MissionTasksColumn.UID);
        for (var row : bucket.rows()) {
            if (Lookups.keyMatches(row, Constants.KEY_COLUMN, id)) {
                var iconId = colIconId == ColumnMap.ABSENT ? null : integer(row, colIconId);
                var uid = integer(row, colUid);
                if (uid == null)
                    throw new IllegalStateException("Mission task of mission " + id + " has no integer uid");
                tasks.add(new MissionTask(iconId, uid));
            }
        }
        return tasks;
    }

    /**
     * Get the title and description of an object template. First match wins.
     * <p>
     * Reads the {@code Objects} row by fixed position, see {@link ObjectsLayout}.
     */
    public Optional<ObjectNameDesc> getObjectNameDesc(int id) {
        var bucket = Lookups.bucketAt(objects.asRaw(), id);
        if (bucket == null) return Optional.empty();

        for (var row : bucket.rows()) {
            if (Lookups.keyMatches(row, ObjectsLayout.ID, id)) {
                return Optional.of(ObjectsLayout.read(row, id));
            }
        }
        return Optional.empty();
    }

    /**
     * Get the path of the icon asset of a render component.
     * <p>
     * Only a text value counts: a matching row whose icon asset is not text is skipped, and the query yields
     * empty unless a later matching row has one.
     */
    public Optional<Latin1Str> getRenderImage(int id) {
        var bucket = Lookups.bucketAt(renderComp.asRaw(), id);
        if (bucket == null) return Optional.empty();

        for (var row : bucket.rows()) {
            if (Lookups.keyMatches(row, Constants.KEY_COLUMN, id)) {
                var iconAsset = text(row, Constants.ICON_ASSET_POSITION);
                if (iconAsset != null) {
                    return Optional.of(iconAsset);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Get the components of an object template.
     * <p>
     * Scans the whole bucket: of all matching rows with component type {@link Constants#COMPONENT_TYPE_RENDER},
     * the last one determines the render component.
     */
    public Components getComponents(int id) {
        var bucket = Lookups.bucketAt(compReg.asRaw(), id);
        if (bucket == null) return Components.NONE;

        Integer render = null;
        for (var row : bucket.rows()) {
            if (Lookups.keyMatches(row, Constants.KEY_COLUMN, id)) {
                var componentType = integer(row, Constants.COMPONENT_TYPE_POSITION);
                if (componentType != null && componentType == Constants.COMPONENT_TYPE_RENDER) {
                    // Later rows overwrite earlier ones
                    render = integer(row, Constants.COMPONENT_ID_POSITION);
                }
            }
        }
        return new Components(render);
    }

    /**
     * Get the parameters of a behavior as name to value, in stored order.
     * A parameter name that occurs twice keeps its first position and its last value.
     */
    public Map<String, Float> getBehaviorParameters(int behaviorId) {
        var parameters = new LinkedHashMap<String, Float>();
        for (var row : behaviorParameters.keyRows(behaviorId)) {
            if (row.getBehaviorId() == behaviorId) {
                parameters.put(row.getParameterId().decode(), row.getValue());
            }
        }
        return parameters;
    }

    /**
     * Get the skills of an object template, in stored order.
     */
    public List<Integer> getObjectSkills(int objectTemplate) {
        var skillIds = new ArrayList<Integer>();
        for (var row : objectSkills.keyRows(objectTemplate)) {
            if (row.getObjectTemplate() == objectTemplate) {
                skillIds.add(row.getSkillId());
            }
        }
        return skillIds;
    }

    /**
     * Get the skills of an item set's skill set, in stored order.
     */
    public List<Integer> getItemSetSkills(int skillSetId) {
        var skillIds = new ArrayList<Integer>();
        for (var row : itemSetSkills.keyRows(skillSetId)) {
            if (row.getSkillSetId() == skillSetId) {
                skillIds.add(row.getSkillId());
            }
        }
        return skillIds;
    }

    private static Integer integer(Row row, int index) {
        Field field = row.fieldAt(index);
        return field == null ? null : field.asInteger();
    }

    private static Latin1Str text(Row row, int index) {
        Field field = row.fieldAt(index);
        return field == null ? null : field.asText();
    }
}
