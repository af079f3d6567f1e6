package com.fdb;

import com.fdb.columns.BehaviorParameterColumn;
import com.fdb.columns.ComponentsRegistryColumn;
import com.fdb.columns.IconsColumn;
import com.fdb.columns.ItemSetSkillsColumn;
import com.fdb.columns.MissionTasksColumn;
import com.fdb.columns.MissionsColumn;
import com.fdb.columns.ObjectSkillsColumn;
import com.fdb.columns.ObjectsColumn;
import com.fdb.columns.RenderComponentColumn;
import com.fdb.columns.SkillBehaviorColumn;
import com.fdb.error.ErrorType;
import com.fdb.error.FdbException;
import com.fdb.ext.Components;
import com.fdb.ext.MissionTask;
import com.fdb.types.Latin1Str;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

@DisplayName("TypedDatabase")
class TypedDatabaseTest {

    @Nested
    @DisplayName("Opening")
    class Opening {

        @Test
        void shouldBindAllTables() throws Exception {
            var db = StoreFixture.store().open();

            assertThat(db.getMissions().getName()).isEqualTo("Missions");
            assertThat(db.getObjects().getName()).isEqualTo("Objects");
            assertThat(db.getSkills().getName()).isEqualTo("SkillBehavior");
            assertThat(db.getRenderComp().getName()).isEqualTo("RenderComponent");
        }

        @Test
        void shouldRejectMissingTable() {
            var store = StoreFixture.store().without(MissionTasksColumn.TABLE_NAME).build();

            assertThatThrownBy(() -> TypedDatabase.open(store))
                    .isInstanceOf(FdbException.class)
                    .hasMessageContaining("MissionTasks")
                    .extracting("errorType")
                    .isEqualTo(ErrorType.TABLE_NOT_FOUND);
        }

        @Test
        void shouldRejectMissingRequiredColumn() {
            var store = StoreFixture.store()
                    .columns(MissionsColumn.TABLE_NAME, "id", "missionIconID")
                    .build();

            assertThatThrownBy(() -> TypedDatabase.open(store))
                    .isInstanceOf(FdbException.class)
                    .hasMessageContaining("isMission")
                    .extracting("errorType")
                    .isEqualTo(ErrorType.COLUMN_NOT_FOUND);
        }

        @Test
        void shouldAcceptReorderedAndExtraColumns() throws Exception {
            var store = StoreFixture.store()
                    .columns(IconsColumn.TABLE_NAME, "IconName", "IconID", "extra", "IconPath")
                    .buckets(IconsColumn.TABLE_NAME, 1)
                    .build();

            var typed = TypedDatabase.open(store);

            assertThat(typed.getIcons().getCol(IconsColumn.ICON_ID)).hasValue(1);
            assertThat(typed.getIcons().getCol(IconsColumn.ICON_PATH)).hasValue(3);
        }
    }

    @Nested
    @DisplayName("Icon path")
    class IconPath {

        @Test
        void shouldReturnFirstMatch() throws Exception {
            var db = StoreFixture.store()
                    .row(IconsColumn.TABLE_NAME, 1, "first.dds", "one")
                    .row(IconsColumn.TABLE_NAME, 1, "second.dds", "one again")
                    .open();

            assertThat(db.getIconPath(1)).hasValue(Latin1Str.of("first.dds"));
        }

        @Test
        void shouldSkipCollidingKeys() throws Exception {
            var db = StoreFixture.store()
                    .row(IconsColumn.TABLE_NAME, 9, "nine.dds", "nine")
                    .row(IconsColumn.TABLE_NAME, 1, "one.dds", "one")
                    .open();

            assertThat(db.getIconPath(1)).hasValue(Latin1Str.of("one.dds"));
            assertThat(db.getIconPath(17)).isEmpty();
        }

        @Test
        void shouldResolveEachCollidingKeyToItsOwnRow() throws Exception {
            var db = StoreFixture.store()
                    .buckets(IconsColumn.TABLE_NAME, 10)
                    .row(IconsColumn.TABLE_NAME, 5, "five.dds", "five")
                    .row(IconsColumn.TABLE_NAME, -1, "minus-one.dds", "minus one")
                    .row(IconsColumn.TABLE_NAME, 15, "fifteen.dds", "fifteen")
                    .open();

            assertThat(db.getIconPath(5)).hasValue(Latin1Str.of("five.dds"));
            assertThat(db.getIconPath(-1)).hasValue(Latin1Str.of("minus-one.dds"));
            assertThat(db.getIconPath(15)).hasValue(Latin1Str.of("fifteen.dds"));
            assertThat(db.getIcons().asRaw().bucketAt(5).rows()).hasSize(3);
        }

        @Test
        void shouldHandleNegativeKeys() throws Exception {
            var db = StoreFixture.store()
                    .row(IconsColumn.TABLE_NAME, -1, "negative.dds", null)
                    .open();

            assertThat(db.getIconPath(-1)).hasValue(Latin1Str.of("negative.dds"));
        }

        @Test
        void shouldBeEmptyWithoutPath() throws Exception {
            var db = StoreFixture.store()
                    .row(IconsColumn.TABLE_NAME, 2, null, "no path")
                    .open();

            assertThat(db.getIconPath(2)).isEmpty();
        }

        @Test
        void shouldBeEmptyWhenPathColumnIsAbsent() throws Exception {
            var db = StoreFixture.store()
                    .columns(IconsColumn.TABLE_NAME, "IconID", "IconName")
                    .row(IconsColumn.TABLE_NAME, 3, "three")
                    .open();

            assertThat(db.getIconPath(3)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Mission data")
    class MissionData {

        @Test
        void shouldReadIconAndFlag() throws Exception {
            var db = StoreFixture.store()
                    .namedRow(MissionsColumn.TABLE_NAME, "id", 100, "isMission", false, "missionIconID", 7)
                    .open();

            var mission = db.getMissionData(100);

            assertThat(mission).isPresent();
            assertThat(mission.get().getMissionIconId()).isEqualTo(7);
            assertThat(mission.get().isMission()).isFalse();
        }

        @Test
        void shouldDefaultToMissionWhenFlagIsMissing() throws Exception {
            var db = StoreFixture.store()
                    .namedRow(MissionsColumn.TABLE_NAME, "id", 101)
                    .open();

            var mission = db.getMissionData(101).orElseThrow();

            assertThat(mission.isMission()).isTrue();
            assertThat(mission.getMissionIconId()).isNull();
        }

        @Test
        void shouldBeEmptyForUnknownMission() throws Exception {
            var db = StoreFixture.store().open();

            assertThat(db.getMissionData(100)).isEmpty();
        }

        @Test
        void shouldFindTypedRowById() throws Exception {
            var db = StoreFixture.store()
                    .namedRow(MissionsColumn.TABLE_NAME, "id", 100, "isMission", true, "defined_type", "Story")
                    .open();

            var row = db.getMissions().get(100).orElseThrow();

            assertThat(row.getId()).isEqualTo(100);
            assertThat(row.getDefinedType()).isEqualTo(Latin1Str.of("Story"));
            assertThat(row.getDefinedSubtype()).isNull();
            assertThat(db.getMissions().get(108)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Mission tasks")
    class MissionTasks {

        @Test
        void shouldReturnAllMatchesInOrder() throws Exception {
            var db = StoreFixture.store()
                    .namedRow(MissionTasksColumn.TABLE_NAME, "id", 3, "IconID", 30, "uid", 1)
                    .namedRow(MissionTasksColumn.TABLE_NAME, "id", 11, "IconID", 99, "uid", 9)
                    .namedRow(MissionTasksColumn.TABLE_NAME, "id", 3, "uid", 2)
                    .namedRow(MissionTasksColumn.TABLE_NAME, "id", 3, "IconID", 30, "uid", 1)
                    .open();

            assertThat(db.getMissionTasks(3)).containsExactly(
                    new MissionTask(30, 1),
                    new MissionTask(null, 2),
                    new MissionTask(30, 1));
        }

        @Test
        void shouldBeEmptyForUnknownMission() throws Exception {
            var db = StoreFixture.store().open();

            assertThat(db.getMissionTasks(3)).isEmpty();
        }

        @Test
        void shouldRejectTaskWithoutUid() throws Exception {
            var db = StoreFixture.store()
                    .namedRow(MissionTasksColumn.TABLE_NAME, "id", 4, "IconID", 40)
                    .open();

            assertThatThrownBy(() -> db.getMissionTasks(4))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("uid");
        }
    }

    @Nested
    @DisplayName("Object name and description")
    class ObjectNameDescQuery {

        @Test
        void shouldFormatFromFixedPositions() throws Exception {
            var db = StoreFixture.store()
                    .namedRow(ObjectsColumn.TABLE_NAME,
                            "id", 1727,
                            "name", "Brick",
                            "displayName", "Red Brick",
                            "description", "A brick",
                            "_internalNotes", "do not ship")
                    .open();

            var nameDesc = db.getObjectNameDesc(1727).orElseThrow();

            assertThat(nameDesc.getTitle()).isEqualTo("Red Brick (Brick) | Object #1727");
            assertThat(nameDesc.getDescription()).isEqualTo("A brick (do not ship)");
        }

        @Test
        void shouldFallBackToObjectNumber() throws Exception {
            var db = StoreFixture.store()
                    .namedRow(ObjectsColumn.TABLE_NAME, "id", 5)
                    .open();

            var nameDesc = db.getObjectNameDesc(5).orElseThrow();

            assertThat(nameDesc.getTitle()).isEqualTo("Object #5");
            assertThat(nameDesc.getDescription()).isEmpty();
        }

        @Test
        void shouldToleratePositionsPastRowEnd() throws Exception {
            var db = StoreFixture.store()
                    .columns(ObjectsColumn.TABLE_NAME, "id", "name")
                    .row(ObjectsColumn.TABLE_NAME, 6, "Short")
                    .open();

            var nameDesc = db.getObjectNameDesc(6).orElseThrow();

            assertThat(nameDesc.getTitle()).isEqualTo("Short | Object #6");
            assertThat(nameDesc.getDescription()).isEmpty();
        }

        @Test
        void shouldBeEmptyForUnknownObject() throws Exception {
            var db = StoreFixture.store().open();

            assertThat(db.getObjectNameDesc(5)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Render image")
    class RenderImage {

        @Test
        void shouldReturnIconAsset() throws Exception {
            var db = StoreFixture.store()
                    .row(RenderComponentColumn.TABLE_NAME, 5, "mesh.nif", "icon.dds")
                    .open();

            assertThat(db.getRenderImage(5)).hasValue(Latin1Str.of("icon.dds"));
        }

        @Test
        void shouldSkipMatchesWithoutTextAsset() throws Exception {
            var db = StoreFixture.store()
                    .row(RenderComponentColumn.TABLE_NAME, 6, "mesh.nif", 17)
                    .row(RenderComponentColumn.TABLE_NAME, 6, "mesh.nif", null)
                    .row(RenderComponentColumn.TABLE_NAME, 6, "mesh.nif", "later.dds")
                    .open();

            assertThat(db.getRenderImage(6)).hasValue(Latin1Str.of("later.dds"));
        }

        @Test
        void shouldBeEmptyWhenNoMatchHasTextAsset() throws Exception {
            var db = StoreFixture.store()
                    .row(RenderComponentColumn.TABLE_NAME, 7, "mesh.nif", 17)
                    .open();

            assertThat(db.getRenderImage(7)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Components")
    class ComponentsQuery {

        @Test
        void shouldUseLastRenderComponent() throws Exception {
            var db = StoreFixture.store()
                    .row(ComponentsRegistryColumn.TABLE_NAME, 10, 2, 100)
                    .row(ComponentsRegistryColumn.TABLE_NAME, 10, 1, 50)
                    .row(ComponentsRegistryColumn.TABLE_NAME, 18, 2, 999)
                    .row(ComponentsRegistryColumn.TABLE_NAME, 10, 2, 200)
                    .open();

            assertThat(db.getComponents(10).getRender()).isEqualTo(200);
        }

        @Test
        void shouldHaveNoRenderWithoutRenderRows() throws Exception {
            var db = StoreFixture.store()
                    .row(ComponentsRegistryColumn.TABLE_NAME, 10, 1, 50)
                    .open();

            assertThat(db.getComponents(10).getRender()).isNull();
            assertThat(db.getComponents(11)).isEqualTo(Components.NONE);
        }

        @Test
        void shouldHandleTableWithoutBuckets() throws Exception {
            var db = StoreFixture.store()
                    .buckets(ComponentsRegistryColumn.TABLE_NAME, 0)
                    .open();

            assertThat(db.getComponents(10)).isSameAs(Components.NONE);
        }
    }

    @Nested
    @DisplayName("Skills and parameters")
    class SkillsAndParameters {

        @Test
        void shouldCollectBehaviorParameters() throws Exception {
            var db = StoreFixture.store()
                    .row(BehaviorParameterColumn.TABLE_NAME, 7, "damage", 1.5f)
                    .row(BehaviorParameterColumn.TABLE_NAME, 15, "other", 9.0f)
                    .row(BehaviorParameterColumn.TABLE_NAME, 7, "radius", 3.0f)
                    .row(BehaviorParameterColumn.TABLE_NAME, 7, "damage", 2.0f)
                    .open();

            assertThat(db.getBehaviorParameters(7))
                    .containsExactly(entry("damage", 2.0f), entry("radius", 3.0f));
            assertThat(db.getBehaviorParameters(8)).isEmpty();
        }

        @Test
        void shouldCollectObjectSkills() throws Exception {
            var db = StoreFixture.store()
                    .row(ObjectSkillsColumn.TABLE_NAME, 4, 100)
                    .row(ObjectSkillsColumn.TABLE_NAME, 12, 999)
                    .row(ObjectSkillsColumn.TABLE_NAME, 4, 101)
                    .open();

            assertThat(db.getObjectSkills(4)).containsExactly(100, 101);
        }

        @Test
        void shouldCollectItemSetSkills() throws Exception {
            var db = StoreFixture.store()
                    .row(ItemSetSkillsColumn.TABLE_NAME, 2, 10)
                    .row(ItemSetSkillsColumn.TABLE_NAME, 2, 11, 1)
                    .row(ItemSetSkillsColumn.TABLE_NAME, 10, 12)
                    .open();

            assertThat(db.getItemSetSkills(2)).containsExactly(10, 11);
        }

        @Test
        void shouldFindSkillById() throws Exception {
            var db = StoreFixture.store()
                    .namedRow(SkillBehaviorColumn.TABLE_NAME,
                            "skillID", 42, "behaviorID", 420, "cooldown", 1.5f, "hideIcon", false)
                    .open();

            var skill = db.getSkills().get(42).orElseThrow();

            assertThat(skill.getBehaviorId()).isEqualTo(420);
            assertThat(skill.getCooldown()).isEqualTo(1.5f);
            assertThat(skill.isHideIcon()).isFalse();
            assertThat(db.getSkills().get(43)).isEmpty();
        }
    }
}
