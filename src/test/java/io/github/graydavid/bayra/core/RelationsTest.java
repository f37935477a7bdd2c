package io.github.graydavid.bayra.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import org.junit.jupiter.api.Test;

public class RelationsTest {
    private final Node child = mock(Node.class);

    @Test
    public void childStaysUntilLastReferenceIsRemoved() {
        Relations relations = new Relations();

        relations.addChildReference(child);
        relations.addChildReference(child);
        relations.removeChildReference(child);

        assertThat(relations.getChildren(), contains(child));
        assertThat(relations.getChildReferenceCount(child), is(1));

        relations.removeChildReference(child);

        assertThat(relations.getChildren(), empty());
        assertThat(relations.getChildReferenceCount(child), is(0));
    }

    @Test
    public void removeChildReferenceThrowsExceptionWithoutReferences() {
        Relations relations = new Relations();

        assertThrows(IllegalStateException.class, () -> relations.removeChildReference(child));
    }

    @Test
    public void extendedChildrenAreASetAndReportChanges() {
        Relations relations = new Relations();

        assertThat(relations.addExtendedChild(child), is(true));
        assertThat(relations.addExtendedChild(child), is(false));
        assertThat(relations.getExtendedChildren(), contains(child));
        assertThat(relations.removeExtendedChild(child), is(true));
        assertThat(relations.removeExtendedChild(child), is(false));
        assertThat(relations.getExtendedChildren(), empty());
    }

    @Test
    public void viewsCannotBeModified() {
        Relations relations = new Relations();

        assertThrows(UnsupportedOperationException.class, () -> relations.getChildren().add(child));
        assertThrows(UnsupportedOperationException.class, () -> relations.getExtendedChildren().add(child));
    }
}
