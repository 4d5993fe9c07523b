/**
 * Event bus plumbing: the events hosts publish and the listeners that feed them to the tracker.
 */
package com.phillippitts.actiontracker.service.subscription;
