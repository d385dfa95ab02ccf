/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: WERP Risk Scoring Engine
 */

package com.acme.werp.inspect;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.record.RawSection;

public interface SectionCheck {
    SectionKind section();
    void run(RawSection raw, Placeholders placeholders, InspectionResultBuilder out) throws Exception;
}
