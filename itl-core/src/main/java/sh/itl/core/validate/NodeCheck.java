// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.validate;

import sh.itl.core.model.NodePath;
import sh.itl.core.model.TypeDef;

/**
 * A local rule evaluated once per definition node, top-level or inline.
 *
 * <p>
 * Checks are stateless and independent of each other; each reports every
 * violation it finds on the node into the context and never stops early.
 */
interface NodeCheck {

    void check(NodePath path, TypeDef node, CheckContext context);
}
