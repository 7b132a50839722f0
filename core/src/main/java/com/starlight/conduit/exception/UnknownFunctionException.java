// Copyright (c) 2010 Rob Eden.
// All rights reserved.
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are met:
//     * Redistributions of source code must retain the above copyright
//       notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above copyright
//       notice, this list of conditions and the following disclaimer in the
//       documentation and/or other materials provided with the distribution.
//     * Neither the name of Conduit nor the
//       names of its contributors may be used to endorse or promote products
//       derived from this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
// ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
// WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
// DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
// DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
// (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
// LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
// ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
// SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.starlight.conduit.exception;

import java.lang.reflect.Method;


/**
 * Thrown locally when a proxy method has no registered qualified name, meaning the
 * interface declaring it was never registered.
 */
public class UnknownFunctionException extends ConduitRuntimeException {
	private static final long serialVersionUID = 3930813064735577713L;


	public UnknownFunctionException( Method method ) {
		super( createDescription( method ) );
	}


	private static String createDescription( Method method ) {
		StringBuilder buf = new StringBuilder( "Unknown function: " );
		buf.append( method.getDeclaringClass().getName() );
		buf.append( '.' );
		buf.append( method.getName() );
		buf.append( "(" );
		boolean first = true;
		for ( Class<?> type : method.getParameterTypes() ) {
			if ( first ) first = false;
			else buf.append( ',' );

			buf.append( type.getSimpleName() );
		}
		buf.append( ")" );
		return buf.toString();
	}
}
