// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small general-purpose utilities shared by the rest of the library.
 */
@NonNullByDefault
package xmlbuilder.util;

import xmlbuilder.util.annotation.NonNullByDefault;
