// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Condition and restart system used to report programming errors in tree construction.
 * <p>
 * A {@link xmlbuilder.util.condition.Condition} is signaled through {@link xmlbuilder.util.condition.ConditionContext};
 * every registered {@link xmlbuilder.util.condition.Handler} sees it <em>before</em> the stack unwinds and may
 * transfer control to a {@link xmlbuilder.util.condition.Restart}. Fatal conditions that nobody unwinds from end in
 * an {@link xmlbuilder.util.condition.UnhandledErrorError}.
 */
@NonNullByDefault
package xmlbuilder.util.condition;

import xmlbuilder.util.annotation.NonNullByDefault;
