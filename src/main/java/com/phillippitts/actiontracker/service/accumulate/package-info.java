/**
 * Merges summaries into a JSON or CSV file shared by every request and, through OS file locks,
 * by every process writing the same path.
 *
 * <p>File Formats:
 * <pre>
 * JSON: {"UsersController#show": {"read": ["users"], "write": [], "services": ["Redis"]}}
 *
 * CSV:  Action,Redis,posts,users
 *       UsersController#show,Y,-,R
 *       PostsController#create,-,W,R
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.actiontracker.service.accumulate;
