import com.posh.script.PoshScript;
import com.posh.script.parser.Value;
import com.posh.script.plugins.ProcessPlugin;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ProcessPluginTest {

    private static PoshScript engine() {
        PoshScript engine = new PoshScript();
        ProcessPlugin.register(engine);
        return engine;
    }

    @Test
    void currentProcessIsListed() {
        long pid = ProcessHandle.current().pid();
        Value v = engine().run("Get-Process | Where-Object { $_.Id -eq " + pid + " }");
        Map<String, Value> rec = v.asRecord();
        assertEquals((double) pid, rec.get("Id").asNumber(), 1e-9);
        assertEquals(Value.Type.STRING, rec.get("Name").type);
        assertTrue(rec.get("CPU").asNumber() >= 0.0);
    }

    @Test
    void unknownNameYieldsNothing() {
        assertTrue(engine().run("Get-Process -Name definitely-not-a-process-xyz").isNull());
    }

    @Test
    void nameFilterMatchesTheCurrentProcess() {
        long pid = ProcessHandle.current().pid();
        String name = engine().run("Get-Process | Where-Object { $_.Id -eq " + pid + " } | ForEach-Object -MemberName Name")
                .asString();
        if (name.isEmpty()) return; // command line not visible on this platform
        Value matches = engine().run("Get-Process -Name '" + name.toUpperCase() + "' | Where-Object { $_.Id -eq " + pid + " }");
        assertEquals(Value.Type.RECORD, matches.type);
    }
}
