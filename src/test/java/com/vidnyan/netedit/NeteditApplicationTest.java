package com.vidnyan.netedit;

import com.vidnyan.netedit.application.port.in.EditNetlistUseCase;
import com.vidnyan.netedit.config.NeteditProperties;
import com.vidnyan.netedit.domain.document.NetlistContext;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class NeteditApplicationTest {

    @Autowired
    private EditNetlistUseCase editNetlistUseCase;

    @Autowired
    private NeteditProperties properties;

    @Autowired
    private NetlistContext netlistContext;

    @Test
    void contextLoads_ShouldWireEditingStack() {
        assertFalse(properties.getEncodings().isEmpty());
        assertEquals("\n", netlistContext.defaultTerminator());

        EditNetlistUseCase.EditResult result = editNetlistUseCase.edit(EditNetlistUseCase.EditRequest.of(
                "* wired\nR1 a b 1k\n.END\n", List.of(EditNetlistUseCase.EditCommand.setValue("R1", "2k"))));

        assertEquals("* wired\nR1 a b 2k\n.END\n", result.text());
    }
}
