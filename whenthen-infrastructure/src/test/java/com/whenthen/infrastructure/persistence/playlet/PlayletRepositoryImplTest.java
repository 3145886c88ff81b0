package com.whenthen.infrastructure.persistence.playlet;

import com.whenthen.domain.playlet.ActionType;
import com.whenthen.domain.playlet.ConditionField;
import com.whenthen.domain.playlet.ConditionLogic;
import com.whenthen.domain.playlet.ConditionOperator;
import com.whenthen.domain.playlet.FileFilter;
import com.whenthen.domain.playlet.FileFilterCategory;
import com.whenthen.domain.playlet.Playlet;
import com.whenthen.domain.playlet.PlayletAction;
import com.whenthen.domain.playlet.SizeOperator;
import com.whenthen.domain.playlet.TriggerCondition;
import com.whenthen.domain.playlet.TriggerConfig;
import com.whenthen.domain.playlet.TriggerType;
import com.whenthen.domain.playlet.repository.PlayletRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * PlayletRepositoryImpl 集成测试
 */
@SpringBootTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.ANY)
@ActiveProfiles("test")
@Transactional
class PlayletRepositoryImplTest {

    @Autowired
    private PlayletRepository playletRepository;

    private Playlet playlet(String id, TriggerType trigger, ActionType... actions) {
        List<PlayletAction> actionList = new ArrayList<>();
        for (ActionType type : actions) {
            actionList.add(PlayletAction.create(type));
        }
        return Playlet.builder()
                .id(id)
                .name(id)
                .trigger(TriggerConfig.of(trigger))
                .actions(actionList)
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }

    @Test
    void testSaveAndFindRoundTrip() {
        Playlet cleanup = playlet("cleanup", TriggerType.SEEDING_RATIO, ActionType.WEBHOOK, ActionType.DELETE_SOURCE);
        cleanup.setTrigger(TriggerConfig.builder().type(TriggerType.SEEDING_RATIO).seedingRatio(2.5).build());
        cleanup.setConditionLogic(ConditionLogic.OR);
        cleanup.getConditions().add(TriggerCondition.builder()
                .id("c1").field(ConditionField.NAME).operator(ConditionOperator.REGEX).value("1080p").negate(true).build());
        cleanup.getConditions().add(TriggerCondition.builder()
                .id("c2").field(ConditionField.TOTAL_SIZE).sizeOperator(SizeOperator.BETWEEN)
                .numericValue(100d).numericValueEnd(900d).build());
        cleanup.setFileFilter(FileFilter.builder()
                .category(FileFilterCategory.CUSTOM).customExtensions(new ArrayList<>(List.of("mkv", "mp4")))
                .selectLargest(true).minSizeMb(50d).build());
        cleanup.getActions().get(0).getConfig().put("url", "http://hooks.local/seeded");

        playletRepository.save(cleanup);

        Playlet found = playletRepository.findById("cleanup").orElseThrow();
        assertThat(found.triggerType()).isEqualTo(TriggerType.SEEDING_RATIO);
        assertThat(found.getTrigger().getSeedingRatio()).isEqualTo(2.5);
        assertThat(found.getConditionLogic()).isEqualTo(ConditionLogic.OR);
        assertThat(found.getConditions()).hasSize(2);
        assertThat(found.getConditions().get(0).isNegate()).isTrue();
        assertThat(found.getConditions().get(0).getOperator()).isEqualTo(ConditionOperator.REGEX);
        assertThat(found.getConditions().get(1).getSizeOperator()).isEqualTo(SizeOperator.BETWEEN);
        assertThat(found.getFileFilter().getCategory()).isEqualTo(FileFilterCategory.CUSTOM);
        assertThat(found.getFileFilter().getCustomExtensions()).containsExactly("mkv", "mp4");
        assertThat(found.getActions()).extracting(PlayletAction::getType)
                .containsExactly(ActionType.WEBHOOK, ActionType.DELETE_SOURCE);
        assertThat(found.getActions().get(0).getString("url")).isEqualTo("http://hooks.local/seeded");
        assertThat(found.getActions().get(1).getConfig().get("deleteFiles")).isEqualTo(true);
        assertThat(found.getCreatedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void testFindAllKeepsUserOrderAcrossUpdates() {
        playletRepository.save(playlet("b", TriggerType.TORRENT_ADDED, ActionType.CAST));
        playletRepository.save(playlet("a", TriggerType.DOWNLOAD_COMPLETE, ActionType.MOVE));
        playletRepository.save(playlet("c", TriggerType.METADATA_RECEIVED, ActionType.NOTIFY));

        Playlet a = playletRepository.findById("a").orElseThrow();
        a.setEnabled(false);
        a.setName("renamed");
        playletRepository.save(a);

        List<Playlet> all = playletRepository.findAll();
        assertThat(all.stream().map(Playlet::getId).collect(Collectors.toList())).containsExactly("b", "a", "c");
        assertThat(all.get(1).isEnabled()).isFalse();
        assertThat(all.get(1).getName()).isEqualTo("renamed");
    }

    @Test
    void testUpdateClearsFileFilter() {
        Playlet p = playlet("p", TriggerType.TORRENT_ADDED, ActionType.CAST);
        p.setFileFilter(FileFilter.builder().category(FileFilterCategory.VIDEO).build());
        playletRepository.save(p);

        p.setFileFilter(null);
        playletRepository.save(p);

        assertThat(playletRepository.findById("p").orElseThrow().getFileFilter()).isNull();
    }

    @Test
    void testDelete() {
        playletRepository.save(playlet("gone", TriggerType.TORRENT_ADDED, ActionType.CAST));

        playletRepository.delete("gone");

        assertThat(playletRepository.findById("gone")).isEmpty();
        assertThat(playletRepository.findAll()).isEmpty();
    }
}
