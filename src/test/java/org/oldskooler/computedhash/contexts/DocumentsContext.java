package org.oldskooler.computedhash.contexts;

import org.oldskooler.computedhash.ModelContext;
import org.oldskooler.computedhash.mapping.ModelBuilder;
import org.oldskooler.computedhash.models.Document;

/**
 * First revision: hashes exactly as the {@code @ComputedHash} annotations on {@link Document} declare them.
 */
public class DocumentsContext extends ModelContext {
    @Override
    public void onModelCreating(ModelBuilder model) {
        model.entity(Document.class).done();
    }
}
