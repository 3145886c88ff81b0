package com.whenthen;

import com.whenthen.app.service.AutomationAppService;
import com.whenthen.client.dto.MultiResponse;
import com.whenthen.client.dto.cmd.TorrentEventCmd;
import com.whenthen.client.dto.data.PlayletDTO;
import com.whenthen.client.dto.data.TaskDTO;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class WhenthenApplicationTest {

    @Autowired
    private AutomationAppService automationAppService;

    @Test
    void testImportedPlayletFiresOnCompletedTorrent() {
        String yaml = "name: Mark done\n"
                + "trigger:\n"
                + "  type: download_complete\n"
                + "conditions:\n"
                + "  - field: name\n"
                + "    operator: contains\n"
                + "    value: startup-check\n"
                + "actions:\n"
                + "  - type: delay\n"
                + "    config:\n"
                + "      seconds: 0\n";
        List<PlayletDTO> imported = automationAppService.importPlaylets(yaml);
        assertEquals(1, imported.size());

        TorrentEventCmd cmd = new TorrentEventCmd();
        cmd.setType("completed");
        cmd.setTorrentId(42);
        cmd.setName("startup-check.iso");
        List<TaskDTO> created = automationAppService.onTorrentEvent(cmd);

        assertEquals(1, created.size());
        MultiResponse<TaskDTO> tasks = automationAppService.listTasks();
        assertTrue(tasks.getData().stream().anyMatch(t -> t.getId().equals(created.get(0).getId())));
    }
}
