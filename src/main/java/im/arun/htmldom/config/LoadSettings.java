package im.arun.htmldom.config;

import im.arun.htmldom.model.ChildrenStorage;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options controlling how markup is turned into a node tree.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoadSettings {

    /**
     * Store every text run in its own child node, even a lone one that is not mixed with other
     * children. Text mixed with children is always stored separately.
     */
    private boolean allTextSeparately = true;

    private ChildrenStorage childrenStorage = ChildrenStorage.EXCLUSIVE;

    public static LoadSettings defaults() {
        return new LoadSettings();
    }

    public LoadSettings allTextSeparately(boolean value) {
        return new LoadSettings(value, childrenStorage);
    }

    public LoadSettings exclusiveChildren() {
        return new LoadSettings(allTextSeparately, ChildrenStorage.EXCLUSIVE);
    }

    public LoadSettings sharableChildren() {
        return new LoadSettings(allTextSeparately, ChildrenStorage.SHARED);
    }
}
