package com.whenthen.domain.playlet;

import org.junit.jupiter.api.Test;

import static com.whenthen.domain.support.Playlets.nameCondition;
import static com.whenthen.domain.support.Playlets.playlet;
import static org.junit.jupiter.api.Assertions.*;

class PlayletTest {

    @Test
    void testExplicitNameWins() {
        Playlet p = playlet("p", TriggerType.DOWNLOAD_COMPLETE, ActionType.MOVE);
        p.setName("  Archive movies ");
        assertEquals("Archive movies", p.displayName());
    }

    @Test
    void testDerivedNameFromActionsAndTrigger() {
        Playlet p = playlet("p", TriggerType.DOWNLOAD_COMPLETE, ActionType.MOVE, ActionType.NOTIFY);
        p.setName("");
        assertEquals("Move & notify on complete", p.displayName());

        p.setTrigger(TriggerConfig.of(TriggerType.TORRENT_ADDED));
        assertEquals("Move & notify", p.displayName());
    }

    @Test
    void testDerivedNameWithConditions() {
        Playlet p = playlet("p", TriggerType.METADATA_RECEIVED, ActionType.DELETE_SOURCE);
        p.setName(null);
        p.getConditions().add(nameCondition(ConditionOperator.CONTAINS, "sample"));
        p.setFileFilter(FileFilter.builder().category(FileFilterCategory.VIDEO).build());

        assertEquals("When video torrents contains 'sample', clean up on metadata", p.displayName());
    }

    @Test
    void testEmptyPlayletName() {
        Playlet p = playlet("p", TriggerType.TORRENT_ADDED);
        p.setName(null);
        assertEquals("New playlet", p.displayName());
    }

    @Test
    void testValidateRejectsActionWithoutType() {
        Playlet p = playlet("p", TriggerType.TORRENT_ADDED, ActionType.CAST);
        p.getActions().get(0).setType(null);
        assertThrows(IllegalArgumentException.class, p::validate);
    }

    @Test
    void testEnumCodesParseCaseInsensitively() {
        assertEquals(TriggerType.SEEDING_RATIO, TriggerType.fromCode("seeding_ratio"));
        assertEquals(ActionType.DELETE_SOURCE, ActionType.fromCode("DELETE_SOURCE"));
        assertThrows(IllegalArgumentException.class, () -> ActionType.fromCode("teleport"));
    }

    @Test
    void testDefaultActionConfigIsCopied() {
        PlayletAction delay = PlayletAction.create(ActionType.DELAY);
        delay.getConfig().put("seconds", 30);
        assertEquals(5, ActionType.DELAY.newDefaultConfig().get("seconds"));
        assertEquals(30, delay.getConfig().get("seconds"));
    }

    @Test
    void testValidateRejectsDuplicateActionIds() {
        Playlet p = playlet("p", TriggerType.DOWNLOAD_COMPLETE, ActionType.MOVE, ActionType.NOTIFY);
        p.getActions().get(0).setId("a1");
        p.getActions().get(1).setId("a1");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, p::validate);
        assertTrue(e.getMessage().contains("a1"));
    }

    @Test
    void testFileFilterWithoutCategoryReadsAsAnyTorrent() {
        Playlet p = playlet("p", TriggerType.DOWNLOAD_COMPLETE, ActionType.MOVE);
        p.setName(null);
        p.getConditions().add(nameCondition(ConditionOperator.CONTAINS, "sample"));
        p.setFileFilter(FileFilter.builder().category(null).build());

        assertEquals("When any torrent contains 'sample', move on complete", p.displayName());
    }
}
