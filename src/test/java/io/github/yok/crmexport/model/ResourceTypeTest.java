package io.github.yok.crmexport.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResourceTypeTest {

    @Test
    void getAssociationTargets_正常ケース_種別ごとの関連先が返ること() {
        assertEquals(List.of(ResourceType.CONTACTS), ResourceType.COMPANIES.getAssociationTargets());
        assertTrue(ResourceType.CONTACTS.getAssociationTargets().isEmpty());
        for (ResourceType type : List.of(ResourceType.NOTES, ResourceType.TASKS,
                ResourceType.CALLS)) {
            assertEquals(List.of(ResourceType.COMPANIES, ResourceType.CONTACTS),
                    type.getAssociationTargets());
        }
    }

    @Test
    void fromName_正常ケース_API名と定数名を大文字小文字を区別せず解決すること() {
        assertEquals(ResourceType.CONTACTS, ResourceType.fromName("contacts"));
        assertEquals(ResourceType.NOTES, ResourceType.fromName(" NOTES "));
        assertEquals("calls", ResourceType.fromName("Calls").getTableName());
    }

    @Test
    void fromName_異常ケース_未知の名前_IllegalArgumentExceptionが送出されること() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> ResourceType.fromName("deals"));
        assertEquals("Unknown resource type: deals", ex.getMessage());
    }
}
