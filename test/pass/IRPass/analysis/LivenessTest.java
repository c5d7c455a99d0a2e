package pass.IRPass.analysis;

import ir.value.Function;
import ir.value.Variable;
import org.junit.jupiter.api.Test;
import util.TestListings;

import static org.junit.jupiter.api.Assertions.*;

public class LivenessTest {

    @Test
    public void testLoopCounterLiveAroundBackEdge() {
        Function f = TestListings.function("count.lst");
        Variable ecx = f.findRegister("ecx");
        int entry = f.getEntryBlockId();
        int header = TestListings.blockAt(f, 0x40100a).getId();
        int body = TestListings.blockAt(f, 0x401010).getId();
        int exit = TestListings.blockAt(f, 0x40101a).getId();

        Liveness live = new Liveness(f);
        assertTrue(live.getLiveIn(header).contains(ecx.getId()));
        assertTrue(live.isLiveOut(ecx.getId(), body));
        assertTrue(live.isLiveOut(ecx.getId(), entry));
        assertFalse(live.getLiveIn(entry).contains(ecx.getId()));
        assertFalse(live.getLiveIn(exit).contains(ecx.getId()));
        assertTrue(live.liveBlocks(ecx.getId()).containsAll(java.util.Set.of(entry, header, body)));
        assertFalse(live.liveBlocks(ecx.getId()).contains(exit));
    }

    @Test
    public void testUnknownBlockHasNothingLive() {
        Liveness live = new Liveness(TestListings.function("pick.lst"));
        assertTrue(live.getLiveIn(999).isEmpty());
    }
}
