/**
 * Immutable value types shared by the pipeline: frames, chunks, packets and session state.
 */
package com.phillippitts.glasscast.domain;
